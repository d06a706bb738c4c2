package com.eatsense.cache.config;

import com.eatsense.cache.service.CacheEntryCodec;
import com.eatsense.cache.store.CacheStore;
import com.eatsense.cache.store.InMemoryCacheStore;
import com.eatsense.cache.store.RedisCacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 缓存核心组件装配
 */
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheCoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheCoreConfig.class);

    /**
     * 不可变策略快照，启动时从配置属性生成一次
     */
    @Bean
    public CachePolicy cachePolicy(CacheProperties properties) {
        CachePolicy policy = CachePolicy.from(properties);
        log.info("Cache policy initialized: prefix={}, defaultTtl={}s, namespaceTtls={}",
            policy.appPrefix(), policy.defaultTtlSeconds(), policy.namespaceTtls());
        return policy;
    }

    @Bean
    public Clock cacheClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheEntryCodec cacheEntryCodec(ObjectMapper objectMapper) {
        return new CacheEntryCodec(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "cache.store", name = "type", havingValue = "redis", matchIfMissing = true)
    public CacheStore redisCacheStore(StringRedisTemplate stringRedisTemplate) {
        return new RedisCacheStore(stringRedisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "cache.store", name = "type", havingValue = "memory")
    public CacheStore inMemoryCacheStore(CacheProperties properties) {
        return new InMemoryCacheStore(Ticker.systemTicker(), properties.getStore().getMemoryMaxSize());
    }

    /**
     * 聚合分支执行线程池
     */
    @Bean(name = "branchExecutor", destroyMethod = "shutdown")
    public ExecutorService branchExecutor(CacheProperties properties) {
        int poolSize = properties.getAggregator().getPoolSize();
        return new ThreadPoolExecutor(
            poolSize,
            poolSize,
            60L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            namedThreadFactory("aggregate-branch-"));
    }

    /**
     * 分支超时计时器
     */
    @Bean(name = "branchTimeoutScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService branchTimeoutScheduler(CacheProperties properties) {
        return Executors.newScheduledThreadPool(
            properties.getAggregator().getTimerThreads(),
            namedThreadFactory("aggregate-timer-"));
    }

    /**
     * 定时任务调度器（过期清理），与分支计时器分开
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("cache-sweeper-");
        return scheduler;
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
