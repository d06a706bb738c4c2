package com.eatsense.cache.service;

import com.eatsense.cache.store.CacheStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分批删除缓冲区
 * 累积到 batchSize 时一次性删除，避免单次大批量阻塞存储
 *
 * <p>{@link #addIfUnchanged} 记录判定时读到的原始值，删除时比较，
 * 期间被重新写入的 Key 不会被删掉。</p>
 */
class BatchKeyDeleter {

    private final CacheStore store;
    private final int batchSize;
    private final List<String> pending;
    private final Map<String, String> pendingIfUnchanged;

    private long deleted;
    private int batches;

    BatchKeyDeleter(CacheStore store, int batchSize) {
        this.store = store;
        this.batchSize = batchSize;
        this.pending = new ArrayList<>(batchSize);
        this.pendingIfUnchanged = new LinkedHashMap<>();
    }

    void add(String key) {
        pending.add(key);
        if (pending.size() >= batchSize) {
            flushUnconditional();
        }
    }

    void addIfUnchanged(String key, String expectedRaw) {
        pendingIfUnchanged.put(key, expectedRaw);
        if (pendingIfUnchanged.size() >= batchSize) {
            flushIfUnchanged();
        }
    }

    void flush() {
        flushUnconditional();
        flushIfUnchanged();
    }

    private void flushUnconditional() {
        if (pending.isEmpty()) {
            return;
        }
        store.delete(List.copyOf(pending));
        deleted += pending.size();
        batches++;
        pending.clear();
    }

    private void flushIfUnchanged() {
        if (pendingIfUnchanged.isEmpty()) {
            return;
        }
        deleted += store.deleteIfEquals(Map.copyOf(pendingIfUnchanged));
        batches++;
        pendingIfUnchanged.clear();
    }

    long deleted() {
        return deleted;
    }

    int batches() {
        return batches;
    }
}
