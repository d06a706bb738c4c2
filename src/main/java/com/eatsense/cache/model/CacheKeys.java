package com.eatsense.cache.model;

/**
 * Key 构建规则
 * <pre>
 * 数据 Key：{prefix}:{namespace}:{rawKey}
 * 锁 Key：  {prefix}:lock:{namespace}:{rawKey}
 * </pre>
 */
public final class CacheKeys {

    private final String prefix;

    public CacheKeys(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("cache prefix must not be blank");
        }
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String dataKey(String rawKey, CacheNamespace namespace) {
        return prefix + ":" + namespace.wireName() + ":" + rawKey;
    }

    public String lockKey(String rawKey, CacheNamespace namespace) {
        return prefix + ":lock:" + namespace.wireName() + ":" + rawKey;
    }

    /**
     * 命名空间匹配模式，scope 为空时匹配整个命名空间
     */
    public String namespacePattern(CacheNamespace namespace, String scope) {
        if (scope == null || scope.isBlank()) {
            return prefix + ":" + namespace.wireName() + ":*";
        }
        return prefix + ":" + namespace.wireName() + ":" + scope + ":*";
    }

    public String allKeysPattern() {
        return prefix + ":*";
    }

    public boolean isLockKey(String fullKey) {
        return fullKey.startsWith(prefix + ":lock:");
    }
}
