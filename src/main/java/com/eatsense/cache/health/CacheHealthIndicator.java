package com.eatsense.cache.health;

import com.eatsense.cache.config.CachePolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * 缓存存储健康检查
 */
@Component("cacheHealthIndicator")
@RequiredArgsConstructor
public class CacheHealthIndicator implements HealthIndicator {

    private final CacheHealthProbe probe;
    private final CachePolicy policy;

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("prefix", policy.appPrefix());

        long start = System.currentTimeMillis();
        boolean healthy = probe.check();
        details.put("store", healthy ? "UP" : "DOWN");
        details.put("latency_ms", System.currentTimeMillis() - start);

        if (healthy) {
            return Health.up().withDetails(details).build();
        }
        return Health.down().withDetails(details).build();
    }
}
