package com.eatsense.cache.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 进程内存储实现
 * 基于 Caffeine 可变过期策略，每个条目独立 TTL
 * 用于测试和本地开发（cache.store.type=memory）
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    private final Cache<String, StoredValue> cache;

    public InMemoryCacheStore() {
        this(Ticker.systemTicker(), 100_000);
    }

    /**
     * @param ticker  时间源，测试中可替换为可控时钟
     * @param maxSize 最大条目数
     */
    public InMemoryCacheStore(Ticker ticker, long maxSize) {
        this.cache = Caffeine.newBuilder()
            .ticker(ticker)
            .maximumSize(maxSize)
            .expireAfter(new PerEntryExpiry())
            .build();
        log.info("In-memory cache store initialized: maxSize={}", maxSize);
    }

    @Override
    public String get(String key) {
        StoredValue stored = cache.getIfPresent(key);
        return stored == null ? null : stored.value();
    }

    @Override
    public void setWithTtl(String key, String value, long ttlSeconds) {
        cache.put(key, new StoredValue(value, TimeUnit.SECONDS.toNanos(ttlSeconds)));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public long delete(Collection<String> keys) {
        long deleted = 0;
        for (String key : keys) {
            if (cache.asMap().remove(key) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public boolean deleteIfEquals(String key, String expected) {
        StoredValue current = cache.getIfPresent(key);
        return current != null
            && current.value().equals(expected)
            && cache.asMap().remove(key, current);
    }

    @Override
    public long deleteIfEquals(Map<String, String> expectedByKey) {
        long deleted = 0;
        for (Map.Entry<String, String> entry : expectedByKey.entrySet()) {
            if (deleteIfEquals(entry.getKey(), entry.getValue())) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public boolean exists(String key) {
        return cache.getIfPresent(key) != null;
    }

    @Override
    public boolean setIfAbsentWithTtl(String key, String marker, long ttlSeconds) {
        StoredValue candidate = new StoredValue(marker, TimeUnit.SECONDS.toNanos(ttlSeconds));
        return cache.asMap().putIfAbsent(key, candidate) == null;
    }

    @Override
    public Stream<String> scan(String pattern, int count) {
        Pattern regex = globToRegex(pattern);
        // 弱一致性视图，不复制全部 Key
        return cache.asMap().keySet().stream()
            .filter(key -> regex.matcher(key).matches());
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * Redis glob 子集：* 和 ?，其余字符按字面量匹配
     */
    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private record StoredValue(String value, long ttlNanos) {}

    private static final class PerEntryExpiry implements Expiry<String, StoredValue> {

        @Override
        public long expireAfterCreate(String key, StoredValue value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, StoredValue value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, StoredValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
