package com.eatsense.cache.service;

import com.eatsense.cache.config.CachePolicy;
import com.eatsense.cache.constant.CacheConstants;
import com.eatsense.cache.model.CacheEntry;
import com.eatsense.cache.model.CacheKeys;
import com.eatsense.cache.model.CacheNamespace;
import com.eatsense.cache.store.CacheStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Cache-Aside 管理器
 * 负责 Key 构建、TTL 解析、get/set 以及带防击穿保护的 getOrSet
 *
 * <p>存储读写异常不会抛给 get/set 的调用方：读失败按未命中处理，写失败直接丢弃。
 * 唯一例外是 getOrSet 中 factory 的异常，调用方需要知道生成确实失败了。</p>
 *
 * <p>getOrSet 采用"占位锁 + 固定间隔轮询 + 本地回源兜底"：
 * 正常情况下同一 Key 只有一次 factory 调用；锁持有者崩溃或轮询超时时，
 * 允许少量重复计算，用可预期的延迟换取可用性。</p>
 */
@Service
public class CacheAsideManager {

    private static final Logger log = LoggerFactory.getLogger(CacheAsideManager.class);

    private final CacheStore store;
    private final CacheEntryCodec codec;
    private final CachePolicy policy;
    private final CacheKeys keys;
    private final Clock clock;

    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter expiredCounter;
    private final Counter corruptCounter;
    private final Counter storeErrorCounter;
    private final Counter leaderLoadCounter;
    private final Counter fallbackLoadCounter;

    public CacheAsideManager(CacheStore store,
                             CacheEntryCodec codec,
                             CachePolicy policy,
                             Clock clock,
                             MeterRegistry meterRegistry) {
        this.store = store;
        this.codec = codec;
        this.policy = policy;
        this.keys = new CacheKeys(policy.appPrefix());
        this.clock = clock;

        this.hitCounter = lookupCounter(meterRegistry, "hit");
        this.missCounter = lookupCounter(meterRegistry, "miss");
        this.expiredCounter = lookupCounter(meterRegistry, "expired");
        this.corruptCounter = lookupCounter(meterRegistry, "corrupt");
        this.storeErrorCounter = Counter.builder("cache.aside.store.errors")
            .description("Store operations degraded to miss / dropped write")
            .register(meterRegistry);
        this.leaderLoadCounter = loadCounter(meterRegistry, "leader");
        this.fallbackLoadCounter = loadCounter(meterRegistry, "fallback");
    }

    private static Counter lookupCounter(MeterRegistry registry, String result) {
        return Counter.builder("cache.aside.lookups").tag("result", result).register(registry);
    }

    private static Counter loadCounter(MeterRegistry registry, String path) {
        return Counter.builder("cache.aside.loads").tag("path", path).register(registry);
    }

    // ==================== 读 ====================

    /**
     * 读取缓存
     *
     * @return 缓存值；未命中、已逻辑过期、内容损坏或存储不可用时返回 null
     */
    public <T> T get(String key, CacheNamespace namespace, Class<T> type) {
        return read(key, namespace, codec.typeOf(type));
    }

    public <T> T get(String key, CacheNamespace namespace, TypeReference<T> type) {
        return read(key, namespace, codec.typeOf(type));
    }

    private <T> T read(String key, CacheNamespace namespace, JavaType type) {
        String redisKey = keys.dataKey(key, namespace);
        String raw;
        try {
            raw = store.get(redisKey);
        } catch (RuntimeException e) {
            storeErrorCounter.increment();
            log.warn("cache=read-error namespace={} key={}: {}", namespace, redisKey, e.getMessage());
            return null;
        }

        if (raw == null) {
            missCounter.increment();
            log.debug("cache=miss namespace={} key={}", namespace, redisKey);
            return null;
        }

        CacheEntry<T> entry;
        try {
            entry = codec.decode(raw, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            corruptCounter.increment();
            log.warn("Failed to parse cache entry {}: {}", redisKey, e.getMessage());
            evictIfUnchanged(redisKey, raw);
            return null;
        }

        if (entry.isExpired(clock.millis())) {
            expiredCounter.increment();
            evictIfUnchanged(redisKey, raw);
            log.debug("cache=expired namespace={} key={}", namespace, redisKey);
            return null;
        }

        hitCounter.increment();
        log.debug("cache=hit namespace={} key={}", namespace, redisKey);
        return entry.value();
    }

    // ==================== 写 ====================

    public <T> void set(String key, T value, CacheNamespace namespace) {
        set(key, value, namespace, null);
    }

    /**
     * 写入缓存，信封 TTL 与存储端过期时间一致
     *
     * @param ttlSeconds 显式 TTL，null 或非正数时按命名空间解析
     */
    public <T> void set(String key, T value, CacheNamespace namespace, Integer ttlSeconds) {
        String redisKey = keys.dataKey(key, namespace);
        int resolvedTtl = resolveTtl(namespace, ttlSeconds);
        CacheEntry<T> entry = new CacheEntry<>(value, resolvedTtl, clock.millis());
        try {
            store.setWithTtl(redisKey, codec.encode(entry), resolvedTtl);
            log.debug("cache=set namespace={} key={} ttl={}", namespace, redisKey, resolvedTtl);
        } catch (JsonProcessingException e) {
            log.warn("cache=encode-error namespace={} key={}: {}", namespace, redisKey, e.getMessage());
        } catch (RuntimeException e) {
            storeErrorCounter.increment();
            log.warn("cache=write-error namespace={} key={}: {}", namespace, redisKey, e.getMessage());
        }
    }

    public void delete(String key, CacheNamespace namespace) {
        String redisKey = keys.dataKey(key, namespace);
        deleteQuietly(redisKey);
        log.debug("cache=delete namespace={} key={}", namespace, redisKey);
    }

    /**
     * 仅检查存储端是否存在 Key，不做逻辑过期判断
     */
    public boolean exists(String key, CacheNamespace namespace) {
        try {
            return store.exists(keys.dataKey(key, namespace));
        } catch (RuntimeException e) {
            storeErrorCounter.increment();
            log.warn("cache=exists-error namespace={} key={}: {}", namespace, key, e.getMessage());
            return false;
        }
    }

    // ==================== TTL 策略 ====================

    /**
     * TTL 解析：显式值 > 命名空间配置 > 全局默认
     */
    public int resolveTtl(CacheNamespace namespace, Integer customTtlSeconds) {
        if (customTtlSeconds != null && customTtlSeconds > 0) {
            return customTtlSeconds;
        }
        Integer namespaceTtl = policy.namespaceTtls().get(namespace);
        return namespaceTtl != null ? namespaceTtl : policy.defaultTtlSeconds();
    }

    public int ttlFor(CacheNamespace namespace) {
        return resolveTtl(namespace, null);
    }

    // ==================== 防击穿 ====================

    public <T> T getOrSet(String key, CacheNamespace namespace, Class<T> type, Supplier<T> factory) {
        return getOrSet(key, namespace, type, factory, null);
    }

    public <T> T getOrSet(String key, CacheNamespace namespace, Class<T> type,
                          Supplier<T> factory, Integer ttlSeconds) {
        return doGetOrSet(key, namespace, codec.typeOf(type), factory, ttlSeconds);
    }

    public <T> T getOrSet(String key, CacheNamespace namespace, TypeReference<T> type,
                          Supplier<T> factory, Integer ttlSeconds) {
        return doGetOrSet(key, namespace, codec.typeOf(type), factory, ttlSeconds);
    }

    private <T> T doGetOrSet(String key, CacheNamespace namespace, JavaType type,
                             Supplier<T> factory, Integer ttlSeconds) {
        // ========== 第一次检查 ==========
        T cached = read(key, namespace, type);
        if (cached != null) {
            return cached;
        }

        String lockKey = keys.lockKey(key, namespace);
        CachePolicy.LockPolicy lock = policy.lock();

        boolean acquired;
        try {
            acquired = store.setIfAbsentWithTtl(lockKey, CacheConstants.LOCK_MARKER, lock.ttlSeconds());
        } catch (RuntimeException e) {
            // 存储不可用时锁没有意义，直接回源
            storeErrorCounter.increment();
            log.warn("cache=lock-error namespace={} key={}: {}", namespace, key, e.getMessage());
            return generate(key, namespace, factory, ttlSeconds, fallbackLoadCounter);
        }

        if (acquired) {
            try {
                // ========== 第二次检查：拿到锁之前可能已有其他请求写入 ==========
                T cachedAfterLock = read(key, namespace, type);
                if (cachedAfterLock != null) {
                    return cachedAfterLock;
                }
                log.debug("cache=generating namespace={} key={}", namespace, key);
                return generate(key, namespace, factory, ttlSeconds, leaderLoadCounter);
            } finally {
                deleteQuietly(lockKey);
            }
        }

        // ========== 未拿到锁：固定间隔轮询，超时后本地回源 ==========
        log.debug("cache=waiting namespace={} key={}", namespace, key);
        long deadline = System.nanoTime() + lock.maxWait().toNanos();
        while (System.nanoTime() < deadline) {
            if (!pause(lock)) {
                break;
            }

            T result = read(key, namespace, type);
            if (result != null) {
                return result;
            }

            if (!lockStillHeld(lockKey)) {
                // 持有者已结束但没有写入，再读一次后退出
                T finalResult = read(key, namespace, type);
                if (finalResult != null) {
                    return finalResult;
                }
                break;
            }
        }

        log.warn("cache=timeout namespace={} key={} - generating fallback", namespace, key);
        return generate(key, namespace, factory, ttlSeconds, fallbackLoadCounter);
    }

    private <T> T generate(String key, CacheNamespace namespace, Supplier<T> factory,
                           Integer ttlSeconds, Counter loadCounter) {
        loadCounter.increment();
        T value = factory.get();
        set(key, value, namespace, ttlSeconds);
        return value;
    }

    private boolean pause(CachePolicy.LockPolicy lock) {
        try {
            Thread.sleep(lock.pollInterval().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("cache=wait-interrupted, falling back to local generation");
            return false;
        }
    }

    private boolean lockStillHeld(String lockKey) {
        try {
            return store.exists(lockKey);
        } catch (RuntimeException e) {
            storeErrorCounter.increment();
            return false;
        }
    }

    /**
     * 只删除读到的那个版本，期间被重新写入的新值保留
     */
    private void evictIfUnchanged(String redisKey, String raw) {
        try {
            store.deleteIfEquals(redisKey, raw);
        } catch (RuntimeException e) {
            storeErrorCounter.increment();
            log.warn("cache=delete-error key={}: {}", redisKey, e.getMessage());
        }
    }

    private void deleteQuietly(String redisKey) {
        try {
            store.delete(redisKey);
        } catch (RuntimeException e) {
            storeErrorCounter.increment();
            log.warn("cache=delete-error key={}: {}", redisKey, e.getMessage());
        }
    }

    public CacheKeys keys() {
        return keys;
    }
}
