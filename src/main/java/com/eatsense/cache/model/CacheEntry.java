package com.eatsense.cache.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 缓存信封
 * 逻辑有效期由 storedAt + ttl 决定，与存储端自身的过期机制相互独立
 *
 * @param value           业务值
 * @param ttlSeconds      写入时解析出的 TTL（秒）
 * @param storedAtEpochMs 写入时间戳（毫秒）
 */
public record CacheEntry<T>(
    @JsonProperty("value") T value,
    @JsonProperty("ttl") int ttlSeconds,
    @JsonProperty("storedAt") long storedAtEpochMs
) {

    public long expiresAtEpochMs() {
        return storedAtEpochMs + ttlSeconds * 1000L;
    }

    /**
     * now >= storedAt + ttl*1000 即视为逻辑过期
     */
    public boolean isExpired(long nowEpochMs) {
        return nowEpochMs >= expiresAtEpochMs();
    }
}
