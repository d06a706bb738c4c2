package com.eatsense.cache.store;

import java.util.Collection;
import java.util.Map;
import java.util.stream.Stream;

/**
 * 键值存储适配层
 * 纯 I/O，不做重试；异常直接抛给调用方，由上层决定降级方式
 */
public interface CacheStore {

    /**
     * @return 原始值，不存在时返回 null
     */
    String get(String key);

    void setWithTtl(String key, String value, long ttlSeconds);

    void delete(String key);

    /**
     * 一次往返批量删除
     *
     * @return 实际删除的数量
     */
    long delete(Collection<String> keys);

    /**
     * 仅当当前值仍等于 expected 时删除（比较后删除，原子）
     *
     * @return 是否删除
     */
    boolean deleteIfEquals(String key, String expected);

    /**
     * 批量比较后删除，一次往返
     *
     * @param expectedByKey Key → 判定时读到的原始值
     * @return 实际删除的数量
     */
    long deleteIfEquals(Map<String, String> expectedByKey);

    boolean exists(String key);

    /**
     * 原子占位（SET NX EX）
     *
     * @return 仅当本次调用创建了 Key 时返回 true
     */
    boolean setIfAbsentWithTtl(String key, String marker, long ttlSeconds);

    /**
     * 基于游标的惰性扫描，调用方必须关闭返回的 Stream
     *
     * @param pattern glob 模式，例如 eatsense:stats:period:*
     * @param count   每批 SCAN COUNT 提示
     */
    Stream<String> scan(String pattern, int count);
}
