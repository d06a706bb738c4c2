package com.eatsense.cache.aggregate;

import com.eatsense.cache.constant.CacheConstants;
import com.eatsense.cache.service.CacheAsideManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 基于缓存的轻量熔断
 * 跳过标记和最近结果都是短 TTL 的普通缓存条目，过期即自动恢复，没有半开探测
 *
 * <pre>
 * 跳过标记：{prefix}:{namespace}:skip:{branch}:{callerId}
 * 最近结果：{prefix}:{namespace}:result:{branch}:{callerId}
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SkipFlagGate {

    private static final String FLAG_VALUE = "true";

    private final CacheAsideManager cacheManager;

    public boolean isCoolingDown(BranchSpec<?> spec, String callerId) {
        return cacheManager.get(skipKey(spec, callerId), spec.getNamespace(), String.class) != null;
    }

    public void startCoolDown(BranchSpec<?> spec, String callerId, int ttlSeconds) {
        cacheManager.set(skipKey(spec, callerId), FLAG_VALUE, spec.getNamespace(), ttlSeconds);
        log.info("Branch {} cooling down for caller {} ({}s)", spec.getName(), callerId, ttlSeconds);
    }

    public <T> T lastResult(BranchSpec<T> spec, String callerId) {
        return cacheManager.get(resultKey(spec, callerId), spec.getNamespace(), spec.getResultType());
    }

    public <T> void rememberResult(BranchSpec<T> spec, String callerId, T value, int ttlSeconds) {
        cacheManager.set(resultKey(spec, callerId), value, spec.getNamespace(), ttlSeconds);
    }

    static String skipKey(BranchSpec<?> spec, String callerId) {
        return CacheConstants.SKIP_FLAG_PREFIX + spec.getName() + ":" + callerId;
    }

    static String resultKey(BranchSpec<?> spec, String callerId) {
        return CacheConstants.BRANCH_RESULT_PREFIX + spec.getName() + ":" + callerId;
    }
}
