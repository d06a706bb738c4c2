package com.eatsense.cache.service;

import com.eatsense.cache.config.CachePolicy;
import com.eatsense.cache.model.CacheKeys;
import com.eatsense.cache.model.CacheNamespace;
import com.eatsense.cache.store.CacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.stream.Stream;

/**
 * 命名空间失效
 * SCAN 游标遍历匹配的 Key，按批删除
 *
 * <p>例如新增一条记录时只失效该用户的 computed:result 作用域，其他用户不受影响。</p>
 */
@Slf4j
@Service
public class NamespaceInvalidator {

    private final CacheStore store;
    private final CachePolicy policy;
    private final CacheKeys keys;

    public NamespaceInvalidator(CacheStore store, CachePolicy policy) {
        this.store = store;
        this.policy = policy;
        this.keys = new CacheKeys(policy.appPrefix());
    }

    /**
     * 失效整个命名空间
     */
    public long invalidateNamespace(CacheNamespace namespace) {
        return invalidateNamespace(namespace, null);
    }

    /**
     * 失效命名空间下某个作用域（通常是用户 ID）
     *
     * @return 删除的 Key 数量；存储不可用时返回已删除的部分
     */
    public long invalidateNamespace(CacheNamespace namespace, String scope) {
        String pattern = keys.namespacePattern(namespace, scope);
        log.debug("Invalidating namespace={} scope={} pattern={}",
            namespace, scope == null ? "all" : scope, pattern);
        return deleteByPattern(pattern);
    }

    /**
     * 清空指定命名空间，namespace 为 null 时清空整个前缀下的 Key
     */
    public long clear(CacheNamespace namespace) {
        String pattern = namespace == null
            ? keys.allKeysPattern()
            : keys.namespacePattern(namespace, null);
        long deleted = deleteByPattern(pattern);
        log.info("Cache cleared: pattern={}, deleted={}", pattern, deleted);
        return deleted;
    }

    private long deleteByPattern(String pattern) {
        BatchKeyDeleter deleter = new BatchKeyDeleter(store, policy.deleteBatchSize());
        try (Stream<String> matched = store.scan(pattern, policy.scanCount())) {
            matched.forEach(deleter::add);
            deleter.flush();
        } catch (RuntimeException e) {
            log.warn("Invalidation failed: pattern={}, deletedSoFar={}: {}",
                pattern, deleter.deleted(), e.getMessage());
        }
        return deleter.deleted();
    }
}
