package com.eatsense.cache.service;

import com.eatsense.cache.config.CachePolicy;
import com.eatsense.cache.model.CacheEntry;
import com.eatsense.cache.model.CacheKeys;
import com.eatsense.cache.store.CacheStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.stream.Stream;

/**
 * 过期条目清理任务
 * 定时扫描前缀下所有 Key，删除逻辑过期或无法解析的条目
 *
 * <p>判定规则与 {@link CacheAsideManager#get} 完全一致；删除时比较判定时读到的原始值，
 * 判定之后被重新写入的 Key 保留，因此与线上流量任意交错时也不会删掉一个仍然有效的值。
 * 锁 Key 由存储端 TTL 自行回收，不在清理范围内。</p>
 */
@Service
@ConditionalOnProperty(prefix = "cache.sweeper", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final CacheStore store;
    private final CacheEntryCodec codec;
    private final CacheKeys keys;
    private final Clock clock;
    private final CachePolicy.SweepPolicy sweepPolicy;

    public ExpirySweeper(CacheStore store, CacheEntryCodec codec, CachePolicy policy, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.keys = new CacheKeys(policy.appPrefix());
        this.clock = clock;
        this.sweepPolicy = policy.sweep();
    }

    /**
     * 定时清理（默认每 2 小时）
     */
    @Scheduled(cron = "${cache.sweeper.cron:0 0 */2 * * *}")
    public void scheduledSweep() {
        sweep();
    }

    public SweepReport sweep() {
        long startTime = System.currentTimeMillis();
        long scanned = 0;
        BatchKeyDeleter deleter = new BatchKeyDeleter(store, sweepPolicy.batchSize());
        boolean completed = true;

        try (Stream<String> stream = store.scan(keys.allKeysPattern(), sweepPolicy.scanCount())) {
            var iterator = stream.iterator();
            while (iterator.hasNext()) {
                String key = iterator.next();
                scanned++;
                if (keys.isLockKey(key)) {
                    continue;
                }
                String staleRaw = staleValue(key);
                if (staleRaw != null) {
                    deleter.addIfUnchanged(key, staleRaw);
                }
            }
            deleter.flush();
        } catch (RuntimeException e) {
            completed = false;
            log.warn("Cleanup failed: {}", e.getMessage());
        }

        SweepReport report = new SweepReport(scanned, deleter.deleted(), deleter.batches(),
            System.currentTimeMillis() - startTime, completed);
        log.info("Cleanup: scanned {} keys, deleted {} expired entries in {} batches ({}ms)",
            report.scanned(), report.deleted(), report.batches(), report.durationMs());
        return report;
    }

    /**
     * 单个 Key 的读取或解析错误只跳过/删除该 Key，不中断整轮清理
     *
     * @return 需要删除时返回判定所依据的原始值，否则返回 null
     */
    private String staleValue(String key) {
        String raw;
        try {
            raw = store.get(key);
        } catch (RuntimeException e) {
            log.debug("Cleanup skipped key={}: {}", key, e.getMessage());
            return null;
        }
        if (raw == null) {
            return null;
        }
        try {
            CacheEntry<JsonNode> entry = codec.decodeEnvelope(raw);
            return entry.isExpired(clock.millis()) ? raw : null;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Cleanup found malformed entry key={}", key);
            return raw;
        }
    }

    /**
     * 清理结果
     *
     * @param completed false 表示扫描中途因存储异常终止
     */
    public record SweepReport(long scanned, long deleted, int batches, long durationMs, boolean completed) {}
}
