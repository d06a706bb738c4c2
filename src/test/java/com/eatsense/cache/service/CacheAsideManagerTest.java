package com.eatsense.cache.service;

import com.eatsense.cache.config.CachePolicy;
import com.eatsense.cache.config.JacksonConfig;
import com.eatsense.cache.model.CacheEntry;
import com.eatsense.cache.model.CacheKeys;
import com.eatsense.cache.model.CacheNamespace;
import com.eatsense.cache.store.CacheStore;
import com.eatsense.cache.store.InMemoryCacheStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Cache-Aside 管理器测试
 */
class CacheAsideManagerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    private final ObjectMapper objectMapper = JacksonConfig.configure(new ObjectMapper());
    private final CacheEntryCodec codec = new CacheEntryCodec(objectMapper);
    private final CacheKeys keys = new CacheKeys("eatsense");

    private InMemoryCacheStore store;
    private SimpleMeterRegistry meterRegistry;
    private CacheAsideManager manager;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore();
        meterRegistry = new SimpleMeterRegistry();
        manager = managerAt(T0, CachePolicy.defaults());
    }

    private CacheAsideManager managerAt(Instant now, CachePolicy policy) {
        return managerAt(store, now, policy);
    }

    private CacheAsideManager managerAt(CacheStore cacheStore, Instant now, CachePolicy policy) {
        return new CacheAsideManager(cacheStore, codec, policy, Clock.fixed(now, ZoneOffset.UTC), meterRegistry);
    }

    public record MealSummary(String name, int calories, List<String> tags) {}

    // ==================== get / set ====================

    @Test
    @DisplayName("写入后读取 - 值结构完整")
    void testSetThenGet_roundTrip() {
        MealSummary meal = new MealSummary("燕麦粥", 320, List.of("breakfast", "fiber"));

        manager.set("meal:1", meal, CacheNamespace.GENERAL);

        assertEquals(meal, manager.get("meal:1", CacheNamespace.GENERAL, MealSummary.class));
        assertEquals(1.0, meterRegistry.counter("cache.aside.lookups", "result", "hit").count());
    }

    @Test
    @DisplayName("泛型读取 - TypeReference")
    void testGet_typeReference() {
        manager.set("tags", List.of("a", "b"), CacheNamespace.LOOKUP_SEARCH);

        List<String> tags = manager.get("tags", CacheNamespace.LOOKUP_SEARCH, new TypeReference<List<String>>() {});

        assertEquals(List.of("a", "b"), tags);
    }

    @Test
    @DisplayName("未命中 - 返回 null")
    void testGet_miss() {
        assertNull(manager.get("missing", CacheNamespace.GENERAL, String.class));
        assertEquals(1.0, meterRegistry.counter("cache.aside.lookups", "result", "miss").count());
    }

    @Test
    @DisplayName("逻辑过期 - 存储中仍有原始数据也视为未命中并删除")
    void testGet_logicallyExpired() {
        manager.set("k", "v", CacheNamespace.GENERAL, 60);
        String dataKey = keys.dataKey("k", CacheNamespace.GENERAL);

        CacheAsideManager later = managerAt(T0.plusSeconds(61), CachePolicy.defaults());

        assertNotNull(store.get(dataKey));
        assertNull(later.get("k", CacheNamespace.GENERAL, String.class));
        assertNull(store.get(dataKey));
    }

    @Test
    @DisplayName("逻辑过期 - 读取与删除之间被重新写入时保留新值")
    void testGet_expiredEvictionKeepsRewrittenValue() {
        manager.set("k", "v", CacheNamespace.GENERAL, 60);
        String dataKey = keys.dataKey("k", CacheNamespace.GENERAL);
        CacheAsideManager later = managerAt(T0.plusSeconds(61), CachePolicy.defaults());

        InMemoryCacheStore racing = spy(store);
        doAnswer(invocation -> {
            later.set("k", "fresh", CacheNamespace.GENERAL, 3600);
            return invocation.callRealMethod();
        }).when(racing).deleteIfEquals(eq(dataKey), anyString());
        CacheAsideManager reader = managerAt(racing, T0.plusSeconds(61), CachePolicy.defaults());

        assertNull(reader.get("k", CacheNamespace.GENERAL, String.class));
        assertEquals("fresh", later.get("k", CacheNamespace.GENERAL, String.class));
        verify(racing, never()).delete(dataKey);
    }

    @Test
    @DisplayName("过期边界 - 恰好到期时视为过期")
    void testGet_expiryBoundary() {
        manager.set("k", "v", CacheNamespace.GENERAL, 60);

        assertEquals("v", managerAt(T0.plusMillis(59_999), CachePolicy.defaults())
            .get("k", CacheNamespace.GENERAL, String.class));
        assertNull(managerAt(T0.plusSeconds(60), CachePolicy.defaults())
            .get("k", CacheNamespace.GENERAL, String.class));
    }

    @Test
    @DisplayName("损坏条目 - 删除并返回 null")
    void testGet_corruptEntry() {
        String dataKey = keys.dataKey("broken", CacheNamespace.GENERAL);
        store.setWithTtl(dataKey, "not-json{", 60);

        assertNull(manager.get("broken", CacheNamespace.GENERAL, String.class));
        assertNull(store.get(dataKey));
        assertEquals(1.0, meterRegistry.counter("cache.aside.lookups", "result", "corrupt").count());
    }

    @Test
    @DisplayName("缺少信封字段 - 视为损坏")
    void testGet_missingEnvelopeFields() {
        String dataKey = keys.dataKey("bare", CacheNamespace.GENERAL);
        store.setWithTtl(dataKey, "{\"value\":\"x\"}", 60);

        assertNull(manager.get("bare", CacheNamespace.GENERAL, String.class));
        assertNull(store.get(dataKey));
    }

    @Test
    @DisplayName("存储异常 - 读按未命中处理，写静默丢弃")
    void testStoreFailure_degrades() {
        CacheStore broken = mock(CacheStore.class);
        when(broken.get(anyString())).thenThrow(new IllegalStateException("connection refused"));
        doThrow(new IllegalStateException("connection refused"))
            .when(broken).setWithTtl(anyString(), anyString(), anyLong());
        when(broken.exists(anyString())).thenThrow(new IllegalStateException("connection refused"));

        CacheAsideManager degraded = managerAt(broken, T0, CachePolicy.defaults());

        assertNull(degraded.get("k", CacheNamespace.GENERAL, String.class));
        assertDoesNotThrow(() -> degraded.set("k", "v", CacheNamespace.GENERAL));
        assertFalse(degraded.exists("k", CacheNamespace.GENERAL));
        assertEquals(3.0, meterRegistry.counter("cache.aside.store.errors").count());
    }

    @Test
    @DisplayName("覆盖写入 - 信封整体替换")
    void testSet_overwrite() {
        manager.set("k", "v1", CacheNamespace.GENERAL, 60);
        CacheAsideManager later = managerAt(T0.plusSeconds(50), CachePolicy.defaults());
        later.set("k", "v2", CacheNamespace.GENERAL, 60);

        CacheAsideManager muchLater = managerAt(T0.plusSeconds(100), CachePolicy.defaults());
        assertEquals("v2", muchLater.get("k", CacheNamespace.GENERAL, String.class));
    }

    @Test
    @DisplayName("删除与存在性检查")
    void testDeleteAndExists() {
        manager.set("k", "v", CacheNamespace.SESSION);
        assertTrue(manager.exists("k", CacheNamespace.SESSION));

        manager.delete("k", CacheNamespace.SESSION);

        assertFalse(manager.exists("k", CacheNamespace.SESSION));
        assertNull(manager.get("k", CacheNamespace.SESSION, String.class));
    }

    // ==================== TTL ====================

    @Test
    @DisplayName("命名空间 TTL - feed:list 配置 900 秒时信封 ttl 为 900")
    void testSet_namespaceTtlWrittenToEnvelope() throws Exception {
        CacheAsideManager feedManager = managerAt(T0,
            CachePolicy.defaults().withNamespaceTtl(CacheNamespace.FEED_LIST, 900));

        feedManager.set("userA:page1", List.of("post1"), CacheNamespace.FEED_LIST);

        CacheEntry<JsonNode> entry = codec.decodeEnvelope(
            store.get(keys.dataKey("userA:page1", CacheNamespace.FEED_LIST)));
        assertEquals(900, entry.ttlSeconds());
        assertEquals(T0.toEpochMilli(), entry.storedAtEpochMs());
    }

    @Test
    @DisplayName("TTL 解析优先级 - 显式值 > 命名空间 > 全局默认")
    void testResolveTtl() {
        assertEquals(60, manager.resolveTtl(CacheNamespace.LOOKUP_SEARCH, 60));
        assertEquals(43200, manager.resolveTtl(CacheNamespace.LOOKUP_SEARCH, null));
        assertEquals(43200, manager.resolveTtl(CacheNamespace.LOOKUP_SEARCH, 0));
        assertEquals(900, manager.resolveTtl(CacheNamespace.GENERAL, null));
        assertEquals(604800, manager.ttlFor(CacheNamespace.NUTRITION_LOOKUP));
    }

    // ==================== getOrSet ====================

    @Test
    @DisplayName("getOrSet - 命中时不调用 factory")
    void testGetOrSet_hit() {
        manager.set("k", "cached", CacheNamespace.COMPUTED_RESULT);

        String result = manager.getOrSet("k", CacheNamespace.COMPUTED_RESULT, String.class,
            () -> fail("factory must not be called"));

        assertEquals("cached", result);
    }

    @Test
    @DisplayName("getOrSet - 未命中时生成、写入并释放锁")
    void testGetOrSet_missGeneratesAndReleasesLock() {
        String result = manager.getOrSet("k", CacheNamespace.COMPUTED_RESULT, String.class, () -> "fresh", 120);

        assertEquals("fresh", result);
        assertEquals("fresh", manager.get("k", CacheNamespace.COMPUTED_RESULT, String.class));
        assertFalse(store.exists(keys.lockKey("k", CacheNamespace.COMPUTED_RESULT)));
        assertEquals(1.0, meterRegistry.counter("cache.aside.loads", "path", "leader").count());
    }

    @Test
    @DisplayName("getOrSet - factory 异常向上抛出，不写缓存且锁已释放")
    void testGetOrSet_factoryFailure() {
        assertThrows(IllegalStateException.class, () -> manager.getOrSet("k", CacheNamespace.COMPUTED_RESULT,
            String.class, () -> {
                throw new IllegalStateException("upstream down");
            }));

        assertFalse(store.exists(keys.lockKey("k", CacheNamespace.COMPUTED_RESULT)));
        assertFalse(manager.exists("k", CacheNamespace.COMPUTED_RESULT));

        // 下一次调用可以正常生成
        assertEquals("ok", manager.getOrSet("k", CacheNamespace.COMPUTED_RESULT, String.class, () -> "ok"));
    }

    @Test
    @DisplayName("getOrSet - 锁被占用时轮询到其他请求写入的值")
    void testGetOrSet_waitsForLockHolder() throws Exception {
        CacheAsideManager fastPoll = managerAt(T0, CachePolicy.defaults().withLock(
            new CachePolicy.LockPolicy(30, Duration.ofMillis(20), Duration.ofSeconds(5))));
        store.setIfAbsentWithTtl(keys.lockKey("k", CacheNamespace.FEED_LIST), "generating", 30);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> {
                TimeUnit.MILLISECONDS.sleep(150);
                fastPoll.set("k", "from-holder", CacheNamespace.FEED_LIST);
                return null;
            });

            String result = fastPoll.getOrSet("k", CacheNamespace.FEED_LIST, String.class,
                () -> fail("factory must not be called"));

            assertEquals("from-holder", result);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("getOrSet - 等待超时后本地回源")
    void testGetOrSet_waitTimeoutFallsBack() {
        CacheAsideManager shortWait = managerAt(T0, CachePolicy.defaults().withLock(
            new CachePolicy.LockPolicy(30, Duration.ofMillis(20), Duration.ofMillis(150))));
        store.setIfAbsentWithTtl(keys.lockKey("k", CacheNamespace.FEED_LIST), "generating", 30);
        AtomicInteger calls = new AtomicInteger();

        String result = shortWait.getOrSet("k", CacheNamespace.FEED_LIST, String.class, () -> {
            calls.incrementAndGet();
            return "fallback";
        });

        assertEquals("fallback", result);
        assertEquals(1, calls.get());
        assertEquals("fallback", shortWait.get("k", CacheNamespace.FEED_LIST, String.class));
        assertEquals(1.0, meterRegistry.counter("cache.aside.loads", "path", "fallback").count());
    }

    @Test
    @DisplayName("getOrSet - 持有者释放锁但未写入时立即回源")
    void testGetOrSet_lockReleasedWithoutValue() {
        CacheAsideManager fastPoll = managerAt(T0, CachePolicy.defaults().withLock(
            new CachePolicy.LockPolicy(30, Duration.ofMillis(20), Duration.ofSeconds(10))));
        String lockKey = keys.lockKey("k", CacheNamespace.FEED_LIST);
        store.setIfAbsentWithTtl(lockKey, "generating", 30);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> {
                TimeUnit.MILLISECONDS.sleep(100);
                store.delete(lockKey);
                return null;
            });

            long start = System.nanoTime();
            String result = fastPoll.getOrSet("k", CacheNamespace.FEED_LIST, String.class, () -> "local");

            assertEquals("local", result);
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 5_000);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("getOrSet - 加锁时存储异常直接回源")
    void testGetOrSet_lockClaimFailure() {
        CacheStore broken = mock(CacheStore.class);
        when(broken.get(anyString())).thenReturn(null);
        when(broken.setIfAbsentWithTtl(anyString(), anyString(), anyLong()))
            .thenThrow(new IllegalStateException("connection refused"));

        CacheAsideManager degraded = managerAt(broken, T0, CachePolicy.defaults());

        assertEquals("direct", degraded.getOrSet("k", CacheNamespace.GENERAL, String.class, () -> "direct"));
        verify(broken).setWithTtl(eq("eatsense:general:k"), anyString(), eq(900L));
        verify(broken, never()).exists(anyString());
    }

    @Test
    @DisplayName("getOrSet - 20 个并发请求 factory 调用不超过 3 次")
    void testGetOrSet_stampede() throws Exception {
        int callers = 20;
        AtomicInteger factoryCalls = new AtomicInteger();
        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(callers);

        try {
            List<Future<String>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    go.await();
                    return manager.getOrSet("hot", CacheNamespace.COMPUTED_RESULT, String.class, () -> {
                        factoryCalls.incrementAndGet();
                        try {
                            TimeUnit.MILLISECONDS.sleep(200);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return "computed";
                    });
                }));
            }

            assertTrue(ready.await(5, TimeUnit.SECONDS));
            go.countDown();

            Set<String> results = ConcurrentHashMap.newKeySet();
            for (Future<String> future : futures) {
                results.add(future.get(15, TimeUnit.SECONDS));
            }

            assertEquals(Set.of("computed"), results);
            assertTrue(factoryCalls.get() <= 3, "factory calls: " + factoryCalls.get());
        } finally {
            executor.shutdownNow();
        }
    }
}
