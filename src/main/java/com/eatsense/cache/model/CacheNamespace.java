package com.eatsense.cache.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 缓存命名空间
 * 每个命名空间是 Key 空间的一个逻辑分区，拥有独立的默认 TTL
 * defaultTtlSeconds 为 null 时使用全局默认 TTL
 */
public enum CacheNamespace {

    GENERAL("general", null),
    LOOKUP_SEARCH("lookup:search", 43_200),
    LOOKUP_DETAIL("lookup:detail", 43_200),
    COMPUTED_RESULT("computed:result", 43_200),
    NUTRITION_LOOKUP("nutrition:lookup", 604_800),
    FEED_LIST("feed:list", 900),
    FEED_DETAIL("feed:detail", 86_400),
    STATS_PERIOD("stats:period", 900),
    SESSION("session", 900),
    SUGGESTIONS("suggestions", null);

    private final String wireName;
    private final Integer defaultTtlSeconds;

    CacheNamespace(String wireName, Integer defaultTtlSeconds) {
        this.wireName = wireName;
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    /** Key 中使用的名称，例如 lookup:search */
    public String wireName() {
        return wireName;
    }

    public Optional<Integer> defaultTtlSeconds() {
        return Optional.ofNullable(defaultTtlSeconds);
    }

    /**
     * 按 wire 名称或枚举名解析（忽略大小写，"-" 视为 "_"）
     */
    public static Optional<CacheNamespace> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(ns -> ns.wireName.equalsIgnoreCase(normalized)
                || ns.name().equals(normalized.toUpperCase(Locale.ROOT).replace('-', '_')))
            .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
