package com.eatsense.cache.config;

import com.eatsense.cache.constant.CacheConstants;
import com.eatsense.cache.model.CacheNamespace;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 不可变缓存策略快照
 * 构造时注入各组件，不同测试可以使用不同的策略互不干扰
 *
 * @param appPrefix         Key 前缀
 * @param defaultTtlSeconds 全局默认 TTL
 * @param namespaceTtls     命名空间 TTL 表（内置默认值 + 配置覆盖）
 * @param lock              生成锁参数
 * @param deleteBatchSize   批量删除大小
 * @param scanCount         SCAN COUNT 提示
 * @param sweep             过期清理参数
 */
public record CachePolicy(
    String appPrefix,
    int defaultTtlSeconds,
    Map<CacheNamespace, Integer> namespaceTtls,
    LockPolicy lock,
    int deleteBatchSize,
    int scanCount,
    SweepPolicy sweep
) {

    public CachePolicy {
        if (defaultTtlSeconds <= 0) {
            throw new IllegalArgumentException("defaultTtlSeconds must be positive: " + defaultTtlSeconds);
        }
        if (deleteBatchSize <= 0) {
            throw new IllegalArgumentException("deleteBatchSize must be positive: " + deleteBatchSize);
        }
        if (sweep == null) {
            throw new IllegalArgumentException("sweep policy must not be null");
        }
        EnumMap<CacheNamespace, Integer> copy = new EnumMap<>(CacheNamespace.class);
        copy.putAll(namespaceTtls);
        namespaceTtls = Collections.unmodifiableMap(copy);
    }

    /**
     * 默认策略：内置命名空间 TTL 表
     */
    public static CachePolicy defaults() {
        return new CachePolicy(
            CacheConstants.DEFAULT_APP_PREFIX,
            CacheConstants.DEFAULT_TTL_SECONDS,
            builtInNamespaceTtls(),
            LockPolicy.defaults(),
            CacheConstants.DELETE_BATCH_SIZE,
            CacheConstants.SCAN_COUNT,
            SweepPolicy.defaults()
        );
    }

    public static CachePolicy from(CacheProperties properties) {
        Map<CacheNamespace, Integer> ttls = builtInNamespaceTtls();
        properties.getNamespaceTtl().forEach((namespace, ttl) -> {
            if (ttl != null && ttl > 0) {
                ttls.put(namespace, ttl);
            }
        });
        CacheProperties.LockConfig lockConfig = properties.getLock();
        return new CachePolicy(
            properties.getPrefix(),
            properties.getDefaultTtlSeconds(),
            ttls,
            new LockPolicy(
                lockConfig.getTtlSeconds(),
                Duration.ofMillis(lockConfig.getPollIntervalMs()),
                Duration.ofMillis(lockConfig.getMaxWaitMs())),
            properties.getInvalidation().getBatchSize(),
            properties.getInvalidation().getScanCount(),
            new SweepPolicy(
                properties.getSweeper().getBatchSize(),
                properties.getSweeper().getScanCount())
        );
    }

    private static Map<CacheNamespace, Integer> builtInNamespaceTtls() {
        Map<CacheNamespace, Integer> ttls = new EnumMap<>(CacheNamespace.class);
        for (CacheNamespace namespace : CacheNamespace.values()) {
            namespace.defaultTtlSeconds().ifPresent(ttl -> ttls.put(namespace, ttl));
        }
        return ttls;
    }

    public CachePolicy withNamespaceTtl(CacheNamespace namespace, int ttlSeconds) {
        Map<CacheNamespace, Integer> ttls = new EnumMap<>(CacheNamespace.class);
        ttls.putAll(namespaceTtls);
        ttls.put(namespace, ttlSeconds);
        return new CachePolicy(appPrefix, defaultTtlSeconds, ttls, lock, deleteBatchSize, scanCount, sweep);
    }

    public CachePolicy withLock(LockPolicy lockPolicy) {
        return new CachePolicy(appPrefix, defaultTtlSeconds, namespaceTtls, lockPolicy, deleteBatchSize, scanCount, sweep);
    }

    public CachePolicy withDeleteBatchSize(int batchSize) {
        return new CachePolicy(appPrefix, defaultTtlSeconds, namespaceTtls, lock, batchSize, scanCount, sweep);
    }

    public CachePolicy withSweep(SweepPolicy sweepPolicy) {
        return new CachePolicy(appPrefix, defaultTtlSeconds, namespaceTtls, lock, deleteBatchSize, scanCount, sweepPolicy);
    }

    /**
     * 生成锁参数
     *
     * @param ttlSeconds   锁自动过期时间
     * @param pollInterval 固定轮询间隔
     * @param maxWait      最长等待，超时后本地回源
     */
    public record LockPolicy(int ttlSeconds, Duration pollInterval, Duration maxWait) {

        public static LockPolicy defaults() {
            return new LockPolicy(
                CacheConstants.LOCK_TTL_SECONDS,
                Duration.ofMillis(CacheConstants.LOCK_POLL_INTERVAL_MS),
                Duration.ofMillis(CacheConstants.LOCK_MAX_WAIT_MS));
        }
    }

    /**
     * 过期清理参数
     *
     * @param batchSize 每批最多删除的 Key 数
     * @param scanCount SCAN COUNT 提示
     */
    public record SweepPolicy(int batchSize, int scanCount) {

        public SweepPolicy {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("sweep batchSize must be positive: " + batchSize);
            }
        }

        public static SweepPolicy defaults() {
            return new SweepPolicy(CacheConstants.DELETE_BATCH_SIZE, CacheConstants.SWEEP_SCAN_COUNT);
        }
    }
}
