package com.eatsense.cache.health;

import com.eatsense.cache.config.CachePolicy;
import com.eatsense.cache.constant.CacheConstants;
import com.eatsense.cache.model.CacheKeys;
import com.eatsense.cache.model.CacheNamespace;
import com.eatsense.cache.store.CacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 存储自检：写入探测 Key、读回、删除
 * 任一步骤异常或读回值不一致都视为不健康
 */
@Slf4j
@Component
public class CacheHealthProbe {

    private final CacheStore store;
    private final CacheKeys keys;

    public CacheHealthProbe(CacheStore store, CachePolicy policy) {
        this.store = store;
        this.keys = new CacheKeys(policy.appPrefix());
    }

    public boolean check() {
        String token = UUID.randomUUID().toString();
        String probeKey = keys.dataKey(CacheConstants.HEALTH_PROBE_PREFIX + token, CacheNamespace.GENERAL);
        try {
            store.setWithTtl(probeKey, token, CacheConstants.HEALTH_PROBE_TTL_SECONDS);
            String readBack = store.get(probeKey);
            store.delete(probeKey);
            return token.equals(readBack);
        } catch (RuntimeException e) {
            log.warn("Cache health check failed: {}", e.getMessage());
            return false;
        }
    }
}
