package com.eatsense.cache.constant;

/**
 * 缓存相关常量
 */
public final class CacheConstants {

    private CacheConstants() {}

    // ==================== Key 前缀 ====================

    /** 应用级 Key 前缀 */
    public static final String DEFAULT_APP_PREFIX = "eatsense";

    /** 跳过标记 Key 前缀（熔断冷却） */
    public static final String SKIP_FLAG_PREFIX = "skip:";

    /** 分支最近一次成功结果 Key 前缀 */
    public static final String BRANCH_RESULT_PREFIX = "result:";

    /** 健康检查探针 Key 前缀 */
    public static final String HEALTH_PROBE_PREFIX = "health:";

    // ==================== TTL 配置 ====================

    /** 全局默认 TTL（秒） */
    public static final int DEFAULT_TTL_SECONDS = 900;

    /** 健康检查探针 TTL（秒） */
    public static final int HEALTH_PROBE_TTL_SECONDS = 60;

    // ==================== 生成锁配置 ====================

    /** 锁标记值 */
    public static final String LOCK_MARKER = "generating";

    /** 锁自动过期时间（秒） */
    public static final int LOCK_TTL_SECONDS = 30;

    /** 等待锁时的轮询间隔（毫秒），固定间隔，不做指数退避 */
    public static final long LOCK_POLL_INTERVAL_MS = 100;

    /** 等待锁的最长时间（毫秒），超时后本地回源 */
    public static final long LOCK_MAX_WAIT_MS = 10_000;

    // ==================== 批量删除 / 扫描 ====================

    /** 批量删除大小 */
    public static final int DELETE_BATCH_SIZE = 200;

    /** SCAN COUNT 提示 */
    public static final int SCAN_COUNT = 100;
    public static final int SWEEP_SCAN_COUNT = 200;

    // ==================== 聚合器配置 ====================

    /** 分支超时后的冷却窗口（秒） */
    public static final int SKIP_FLAG_TTL_SECONDS = 180;

    /** 分支成功结果的短 TTL（秒） */
    public static final int BRANCH_RESULT_TTL_SECONDS = 300;

    /** 慢聚合告警阈值（毫秒） */
    public static final long SLOW_AGGREGATE_THRESHOLD_MS = 2000;
}
