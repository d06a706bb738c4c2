package com.eatsense.cache.controller;

import com.eatsense.cache.dto.ApiResponse;
import com.eatsense.cache.dto.CacheSetRequest;
import com.eatsense.cache.dto.HealthCheckResult;
import com.eatsense.cache.exception.GlobalExceptionHandler.CacheKeyNotFoundException;
import com.eatsense.cache.health.CacheHealthProbe;
import com.eatsense.cache.model.CacheNamespace;
import com.eatsense.cache.service.CacheAsideManager;
import com.eatsense.cache.service.ExpirySweeper;
import com.eatsense.cache.service.NamespaceInvalidator;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 缓存运维 API
 * 提供：
 * 1. 单 Key 读写删除
 * 2. 命名空间失效 / 全量清空
 * 3. 手动触发过期清理
 * 4. 存储自检
 *
 * <p>命名空间路径参数既支持 wire name（lookup:search），也支持枚举名（LOOKUP_SEARCH / lookup-search）。</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheAdminController {

    private final CacheAsideManager cacheManager;
    private final NamespaceInvalidator invalidator;
    private final ObjectProvider<ExpirySweeper> sweeper;
    private final CacheHealthProbe healthProbe;
    private final Clock clock;

    /**
     * 读取缓存值
     */
    @GetMapping("/{namespace}/{key}")
    public ApiResponse<JsonNode> get(@PathVariable String namespace, @PathVariable String key) {
        CacheNamespace ns = parseNamespace(namespace);
        JsonNode value = cacheManager.get(key, ns, JsonNode.class);
        if (value == null) {
            throw new CacheKeyNotFoundException(ns.wireName(), key);
        }
        return ApiResponse.success(value);
    }

    /**
     * 写入缓存值
     */
    @PutMapping("/{namespace}/{key}")
    public ApiResponse<Map<String, Object>> put(@PathVariable String namespace,
                                                @PathVariable String key,
                                                @RequestBody CacheSetRequest request) {
        CacheNamespace ns = parseNamespace(namespace);
        if (request.getValue() == null || request.getValue().isNull()) {
            throw new IllegalArgumentException("value is required");
        }
        if (request.getTtl() != null && request.getTtl() <= 0) {
            throw new IllegalArgumentException("ttl must be positive: " + request.getTtl());
        }

        cacheManager.set(key, request.getValue(), ns, request.getTtl());

        Map<String, Object> result = new HashMap<>();
        result.put("namespace", ns.wireName());
        result.put("key", key);
        result.put("ttl", cacheManager.resolveTtl(ns, request.getTtl()));
        return ApiResponse.success(result);
    }

    /**
     * 删除单个 Key
     */
    @DeleteMapping("/{namespace}/{key}")
    public ApiResponse<Void> delete(@PathVariable String namespace, @PathVariable String key) {
        CacheNamespace ns = parseNamespace(namespace);
        cacheManager.delete(key, ns);
        return ApiResponse.success();
    }

    /**
     * 检查 Key 是否存在（存在 200，不存在 404）
     */
    @RequestMapping(value = "/{namespace}/{key}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> exists(@PathVariable String namespace, @PathVariable String key) {
        CacheNamespace ns = parseNamespace(namespace);
        return cacheManager.exists(key, ns)
            ? ResponseEntity.ok().build()
            : ResponseEntity.notFound().build();
    }

    /**
     * 失效命名空间，可选按作用域（通常是用户 ID）
     */
    @DeleteMapping("/{namespace}")
    public ApiResponse<Map<String, Object>> invalidate(@PathVariable String namespace,
                                                       @RequestParam(required = false) String scope) {
        CacheNamespace ns = parseNamespace(namespace);
        log.info("Manual invalidation: namespace={}, scope={}", ns, scope);

        long deleted = invalidator.invalidateNamespace(ns, scope);

        Map<String, Object> result = new HashMap<>();
        result.put("namespace", ns.wireName());
        result.put("scope", scope);
        result.put("deleted", deleted);
        return ApiResponse.success(result);
    }

    /**
     * 清空前缀下全部缓存
     */
    @DeleteMapping
    public ApiResponse<Map<String, Object>> clearAll() {
        log.warn("Manual clear of all cache entries");
        long deleted = invalidator.clear(null);
        return ApiResponse.success(Map.of("deleted", deleted));
    }

    /**
     * 手动触发一轮过期清理
     */
    @PostMapping("/sweep")
    public ResponseEntity<ApiResponse<ExpirySweeper.SweepReport>> sweep() {
        ExpirySweeper expirySweeper = sweeper.getIfAvailable();
        if (expirySweeper == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error(503, "过期清理未启用"));
        }
        return ResponseEntity.ok(ApiResponse.success(expirySweeper.sweep()));
    }

    /**
     * 存储自检
     */
    @GetMapping("/health/check")
    public ApiResponse<HealthCheckResult> healthCheck() {
        boolean healthy = healthProbe.check();
        return ApiResponse.success(HealthCheckResult.of(healthy, Instant.now(clock).toString()));
    }

    private static CacheNamespace parseNamespace(String value) {
        return CacheNamespace.parse(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown cache namespace: " + value));
    }
}
