package com.eatsense.cache.aggregate;

/**
 * 单个分支的执行结果
 *
 * @param name      分支名
 * @param outcome   状态
 * @param value     结果值（降级时为缓存值或兜底值）
 * @param elapsedMs 分支耗时
 * @param error     失败原因，成功时为 null
 */
public record BranchResult<T>(
    String name,
    BranchOutcome outcome,
    T value,
    long elapsedMs,
    String error
) {

    static <T> BranchResult<T> success(String name, T value, long elapsedMs) {
        return new BranchResult<>(name, BranchOutcome.SUCCESS, value, elapsedMs, null);
    }

    static <T> BranchResult<T> degraded(String name, BranchOutcome outcome, T value, long elapsedMs, String error) {
        return new BranchResult<>(name, outcome, value, elapsedMs, error);
    }

    public boolean isDegraded() {
        return outcome.isDegraded();
    }
}
