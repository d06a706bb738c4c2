package com.eatsense.cache.aggregate;

/**
 * 分支执行结果状态，仅随聚合结果返回，不持久化
 */
public enum BranchOutcome {

    /** 调用成功 */
    SUCCESS,

    /** 处于冷却期，返回了上一次缓存的结果 */
    PARTIAL,

    /** 处于冷却期且没有缓存结果，返回兜底值 */
    SKIPPED,

    /** 超过分支超时，返回兜底值 */
    TIMEOUT,

    /** 调用异常，返回兜底值 */
    ERROR;

    public boolean isDegraded() {
        return this != SUCCESS;
    }
}
