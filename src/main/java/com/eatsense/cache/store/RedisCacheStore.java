package com.eatsense.cache.store;

import org.springframework.data.redis.connection.ReturnType;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.serializer.RedisSerializer;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Redis 存储实现
 * 基于 StringRedisTemplate（Lettuce 连接池）
 */
public class RedisCacheStore implements CacheStore {

    /**
     * 值未变时才删除，返回 1 / 0
     */
    static final RedisScript<Long> COMPARE_AND_DELETE = new DefaultRedisScript<>(
        "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) else return 0 end",
        Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisCacheStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public String get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public void setWithTtl(String key, String value, long ttlSeconds) {
        redisTemplate.opsForValue().set(key, value, ttlSeconds, TimeUnit.SECONDS);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Long deleted = redisTemplate.delete(keys);
        return deleted == null ? 0 : deleted;
    }

    @Override
    public boolean deleteIfEquals(String key, String expected) {
        Long deleted = redisTemplate.execute(COMPARE_AND_DELETE, List.of(key), expected);
        return deleted != null && deleted > 0;
    }

    @Override
    public long deleteIfEquals(Map<String, String> expectedByKey) {
        if (expectedByKey.isEmpty()) {
            return 0;
        }
        byte[] script = COMPARE_AND_DELETE.getScriptAsString().getBytes(StandardCharsets.UTF_8);
        RedisSerializer<String> serializer = RedisSerializer.string();
        List<Object> results = redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
            expectedByKey.forEach((key, expected) -> connection.scriptingCommands().eval(
                script, ReturnType.INTEGER, 1, serializer.serialize(key), serializer.serialize(expected)));
            return null;
        });
        long deleted = 0;
        for (Object result : results) {
            if (result instanceof Long) {
                deleted += (Long) result;
            }
        }
        return deleted;
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key));
    }

    @Override
    public boolean setIfAbsentWithTtl(String key, String marker, long ttlSeconds) {
        return Boolean.TRUE.equals(
            redisTemplate.opsForValue().setIfAbsent(key, marker, ttlSeconds, TimeUnit.SECONDS)
        );
    }

    @Override
    public Stream<String> scan(String pattern, int count) {
        ScanOptions options = ScanOptions.scanOptions()
            .match(pattern)
            .count(count)
            .build();
        Cursor<String> cursor = redisTemplate.scan(options);
        // 关闭 Stream 时释放游标
        return cursor.stream();
    }
}
