package com.eatsense.cache.dto;

/**
 * 存储自检结果
 *
 * @param status    healthy | unhealthy
 * @param timestamp ISO-8601 时间
 * @param service   服务名
 */
public record HealthCheckResult(String status, String timestamp, String service) {

    public static final String SERVICE_NAME = "redis-cache";

    public static HealthCheckResult of(boolean healthy, String timestamp) {
        return new HealthCheckResult(healthy ? "healthy" : "unhealthy", timestamp, SERVICE_NAME);
    }
}
