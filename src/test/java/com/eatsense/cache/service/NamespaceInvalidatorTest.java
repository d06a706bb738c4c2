package com.eatsense.cache.service;

import com.eatsense.cache.config.CachePolicy;
import com.eatsense.cache.config.JacksonConfig;
import com.eatsense.cache.model.CacheNamespace;
import com.eatsense.cache.store.CacheStore;
import com.eatsense.cache.store.InMemoryCacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 命名空间失效测试
 */
class NamespaceInvalidatorTest {

    private RecordingCacheStore store;
    private CacheAsideManager manager;

    @BeforeEach
    void setUp() {
        store = new RecordingCacheStore(new InMemoryCacheStore());
        manager = new CacheAsideManager(store, new CacheEntryCodec(JacksonConfig.configure(new ObjectMapper())),
            CachePolicy.defaults(), Clock.systemUTC(), new SimpleMeterRegistry());
    }

    @Test
    @DisplayName("按作用域失效 - 只删除该用户的条目")
    void testInvalidateNamespace_scoped() {
        manager.set("userA:2024-05", "a1", CacheNamespace.COMPUTED_RESULT);
        manager.set("userA:2024-06", "a2", CacheNamespace.COMPUTED_RESULT);
        manager.set("userB:2024-05", "b1", CacheNamespace.COMPUTED_RESULT);
        manager.set("userA:page1", "feed", CacheNamespace.FEED_LIST);

        NamespaceInvalidator invalidator = new NamespaceInvalidator(store, CachePolicy.defaults());
        long deleted = invalidator.invalidateNamespace(CacheNamespace.COMPUTED_RESULT, "userA");

        assertEquals(2, deleted);
        assertNull(manager.get("userA:2024-05", CacheNamespace.COMPUTED_RESULT, String.class));
        assertNull(manager.get("userA:2024-06", CacheNamespace.COMPUTED_RESULT, String.class));
        assertEquals("b1", manager.get("userB:2024-05", CacheNamespace.COMPUTED_RESULT, String.class));
        assertEquals("feed", manager.get("userA:page1", CacheNamespace.FEED_LIST, String.class));
    }

    @Test
    @DisplayName("整个命名空间失效 - 其他命名空间不受影响")
    void testInvalidateNamespace_whole() {
        manager.set("userA:1", "a", CacheNamespace.FEED_LIST);
        manager.set("userB:1", "b", CacheNamespace.FEED_LIST);
        manager.set("post1", "p", CacheNamespace.FEED_DETAIL);

        NamespaceInvalidator invalidator = new NamespaceInvalidator(store, CachePolicy.defaults());

        assertEquals(2, invalidator.invalidateNamespace(CacheNamespace.FEED_LIST));
        assertEquals("p", manager.get("post1", CacheNamespace.FEED_DETAIL, String.class));
    }

    @Test
    @DisplayName("分批删除 - 每批不超过 batchSize")
    void testInvalidateNamespace_batches() {
        for (int i = 0; i < 5; i++) {
            manager.set("userA:" + i, "v" + i, CacheNamespace.STATS_PERIOD);
        }

        NamespaceInvalidator invalidator = new NamespaceInvalidator(store,
            CachePolicy.defaults().withDeleteBatchSize(2));

        assertEquals(5, invalidator.invalidateNamespace(CacheNamespace.STATS_PERIOD, "userA"));
        assertEquals(List.of(2, 2, 1), store.batchSizes());
    }

    @Test
    @DisplayName("无匹配 Key - 返回 0 且不发起删除")
    void testInvalidateNamespace_noMatch() {
        NamespaceInvalidator invalidator = new NamespaceInvalidator(store, CachePolicy.defaults());

        assertEquals(0, invalidator.invalidateNamespace(CacheNamespace.SESSION, "nobody"));
        assertTrue(store.batchSizes().isEmpty());
    }

    @Test
    @DisplayName("清空 - 指定命名空间或整个前缀")
    void testClear() {
        manager.set("a", "1", CacheNamespace.GENERAL);
        manager.set("b", "2", CacheNamespace.SESSION);
        manager.set("c", "3", CacheNamespace.SESSION);

        NamespaceInvalidator invalidator = new NamespaceInvalidator(store, CachePolicy.defaults());

        assertEquals(2, invalidator.clear(CacheNamespace.SESSION));
        assertEquals("1", manager.get("a", CacheNamespace.GENERAL, String.class));
        assertEquals(1, invalidator.clear(null));
        assertNull(manager.get("a", CacheNamespace.GENERAL, String.class));
    }

    @Test
    @DisplayName("存储异常 - 不抛出，返回已删除数量")
    void testInvalidateNamespace_storeFailure() {
        CacheStore broken = mock(CacheStore.class);
        when(broken.scan(anyString(), anyInt())).thenThrow(new IllegalStateException("connection refused"));

        NamespaceInvalidator invalidator = new NamespaceInvalidator(broken, CachePolicy.defaults());

        assertEquals(0, invalidator.invalidateNamespace(CacheNamespace.FEED_LIST, "userA"));
    }
}
