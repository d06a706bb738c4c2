package com.eatsense.cache.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 聚合结果：每个分支的值和状态标记
 */
public final class CompositeResult {

    private final Map<String, BranchResult<?>> branches;
    private final long totalMs;
    private final boolean aggregateFailed;

    CompositeResult(Map<String, BranchResult<?>> branches, long totalMs, boolean aggregateFailed) {
        this.branches = Collections.unmodifiableMap(new LinkedHashMap<>(branches));
        this.totalMs = totalMs;
        this.aggregateFailed = aggregateFailed;
    }

    /**
     * 聚合流程本身出错时的整体兜底：所有分支都取兜底值
     */
    static CompositeResult allDefaults(List<BranchSpec<?>> specs, long totalMs, String error) {
        Map<String, BranchResult<?>> results = new LinkedHashMap<>();
        if (specs != null) {
            specs.stream()
                .filter(Objects::nonNull)
                .forEach(spec -> results.put(spec.getName(), BranchResult.degraded(
                    spec.getName(), BranchOutcome.ERROR, spec.fallbackValue(), 0, error)));
        }
        return new CompositeResult(results, totalMs, true);
    }

    public <T> T value(String name, Class<T> type) {
        BranchResult<?> result = branches.get(name);
        return result == null ? null : type.cast(result.value());
    }

    public BranchResult<?> result(String name) {
        return branches.get(name);
    }

    public BranchOutcome outcome(String name) {
        BranchResult<?> result = branches.get(name);
        return result == null ? null : result.outcome();
    }

    public Map<String, BranchResult<?>> branches() {
        return branches;
    }

    /**
     * 分支名 → 状态，供响应中的降级标记使用
     */
    public Map<String, BranchOutcome> statusMarkers() {
        Map<String, BranchOutcome> markers = new LinkedHashMap<>();
        branches.forEach((name, result) -> markers.put(name, result.outcome()));
        return markers;
    }

    public boolean isDegraded() {
        return aggregateFailed || branches.values().stream().anyMatch(BranchResult::isDegraded);
    }

    public boolean isAggregateFailed() {
        return aggregateFailed;
    }

    public long totalMs() {
        return totalMs;
    }
}
