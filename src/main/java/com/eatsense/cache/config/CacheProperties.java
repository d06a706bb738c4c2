package com.eatsense.cache.config;

import com.eatsense.cache.constant.CacheConstants;
import com.eatsense.cache.model.CacheNamespace;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * 缓存配置属性类
 * 仅用于绑定，运行期通过 {@link CachePolicy} 使用不可变快照
 */
@Data
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

    /** Key 前缀 */
    private String prefix = CacheConstants.DEFAULT_APP_PREFIX;

    /** 全局默认 TTL（秒） */
    private int defaultTtlSeconds = CacheConstants.DEFAULT_TTL_SECONDS;

    /** 命名空间 TTL 覆盖（秒） */
    private Map<CacheNamespace, Integer> namespaceTtl = new EnumMap<>(CacheNamespace.class);

    /** 存储配置 */
    private StoreConfig store = new StoreConfig();

    /** 生成锁配置 */
    private LockConfig lock = new LockConfig();

    /** 命名空间失效配置 */
    private InvalidationConfig invalidation = new InvalidationConfig();

    /** 过期清理配置 */
    private SweeperConfig sweeper = new SweeperConfig();

    /** 聚合器配置 */
    private AggregatorConfig aggregator = new AggregatorConfig();

    public enum StoreType { REDIS, MEMORY }

    @Data
    public static class StoreConfig {
        /** redis | memory */
        private StoreType type = StoreType.REDIS;
        /** 内存存储最大条目数 */
        private long memoryMaxSize = 100_000;
    }

    @Data
    public static class LockConfig {
        /** 锁自动过期时间（秒） */
        private int ttlSeconds = CacheConstants.LOCK_TTL_SECONDS;
        /** 轮询间隔（毫秒） */
        private long pollIntervalMs = CacheConstants.LOCK_POLL_INTERVAL_MS;
        /** 最长等待（毫秒） */
        private long maxWaitMs = CacheConstants.LOCK_MAX_WAIT_MS;
    }

    @Data
    public static class InvalidationConfig {
        /** 批量删除大小 */
        private int batchSize = CacheConstants.DELETE_BATCH_SIZE;
        /** SCAN COUNT */
        private int scanCount = CacheConstants.SCAN_COUNT;
    }

    @Data
    public static class SweeperConfig {
        /** 是否启用定时清理 */
        private boolean enabled = true;
        /** 执行周期，默认每 2 小时 */
        private String cron = "0 0 */2 * * *";
        /** 批量删除大小 */
        private int batchSize = CacheConstants.DELETE_BATCH_SIZE;
        /** SCAN COUNT */
        private int scanCount = CacheConstants.SWEEP_SCAN_COUNT;
    }

    @Data
    public static class AggregatorConfig {
        /** 分支执行线程数 */
        private int poolSize = 32;
        /** 超时计时线程数 */
        private int timerThreads = 2;
        /** 慢聚合告警阈值（毫秒） */
        private long slowThresholdMs = CacheConstants.SLOW_AGGREGATE_THRESHOLD_MS;
        /** 冷却窗口（秒） */
        private int skipTtlSeconds = CacheConstants.SKIP_FLAG_TTL_SECONDS;
        /** 成功结果短 TTL（秒） */
        private int resultTtlSeconds = CacheConstants.BRANCH_RESULT_TTL_SECONDS;
    }
}
