package com.eatsense.cache.aggregate;

import com.eatsense.cache.model.CacheNamespace;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 聚合分支定义
 *
 * <ul>
 *   <li>timeout：分支私有超时，为空或大于整体截止时间时取整体截止时间</li>
 *   <li>fallback：超时 / 异常 / 冷却时返回的兜底值（例如"暂时不可用"）</li>
 *   <li>coolDown：超时后写入跳过标记，冷却期内不再调用；成功结果短 TTL 写回缓存供冷却期使用</li>
 * </ul>
 */
@Slf4j
@Getter
public final class BranchSpec<T> {

    private final String name;
    private final Class<T> resultType;
    private final BranchCall<T> call;
    private final Duration timeout;
    private final Supplier<T> fallback;
    private final boolean coolDown;
    private final CacheNamespace namespace;
    private final Integer skipTtlSeconds;
    private final Integer resultTtlSeconds;
    private final Predicate<? super T> cacheable;

    @Builder
    private BranchSpec(String name,
                       Class<T> resultType,
                       BranchCall<T> call,
                       Duration timeout,
                       Supplier<T> fallback,
                       boolean coolDown,
                       CacheNamespace namespace,
                       Integer skipTtlSeconds,
                       Integer resultTtlSeconds,
                       Predicate<? super T> cacheable) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("branch name must not be blank");
        }
        this.name = name;
        this.resultType = Objects.requireNonNull(resultType, "resultType");
        this.call = Objects.requireNonNull(call, "call");
        this.timeout = timeout;
        this.fallback = fallback != null ? fallback : () -> null;
        this.coolDown = coolDown;
        this.namespace = namespace != null ? namespace : CacheNamespace.SUGGESTIONS;
        this.skipTtlSeconds = skipTtlSeconds;
        this.resultTtlSeconds = resultTtlSeconds;
        this.cacheable = cacheable != null ? cacheable : Objects::nonNull;
    }

    /**
     * 兜底值本身抛异常时返回 null
     */
    T fallbackValue() {
        try {
            return fallback.get();
        } catch (RuntimeException e) {
            log.warn("Fallback for branch {} failed, using null: {}", name, e.getMessage());
            return null;
        }
    }

    /**
     * 分支实际生效的超时
     */
    Duration effectiveTimeout(Duration overallDeadline) {
        if (timeout == null || timeout.isNegative() || timeout.isZero() || timeout.compareTo(overallDeadline) > 0) {
            return overallDeadline;
        }
        return timeout;
    }
}
