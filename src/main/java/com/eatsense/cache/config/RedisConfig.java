package com.eatsense.cache.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis 连接配置
 * Lettuce 连接池 + 断线自动重连，命令超时后按未命中降级
 */
@Configuration
@ConditionalOnProperty(prefix = "cache.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    @Value("${spring.data.redis.host:localhost}")
    private String host;

    @Value("${spring.data.redis.port:6379}")
    private int port;

    @Value("${spring.data.redis.password:}")
    private String password;

    @Value("${spring.data.redis.timeout:1000ms}")
    private Duration commandTimeout;

    @Value("${spring.data.redis.connect-timeout:5000ms}")
    private Duration connectTimeout;

    /**
     * Lettuce 客户端资源配置
     */
    @Bean(destroyMethod = "shutdown")
    public ClientResources clientResources() {
        return DefaultClientResources.builder()
            .ioThreadPoolSize(4)
            .computationThreadPoolSize(4)
            .build();
    }

    /**
     * 连接池配置
     */
    @Bean
    public GenericObjectPoolConfig<?> redisPoolConfig() {
        GenericObjectPoolConfig<?> config = new GenericObjectPoolConfig<>();
        config.setMaxTotal(64);
        config.setMaxIdle(16);
        config.setMinIdle(4);
        config.setMaxWait(Duration.ofMillis(1000));
        // 空闲连接检测
        config.setTestWhileIdle(true);
        config.setTimeBetweenEvictionRuns(Duration.ofSeconds(30));
        return config;
    }

    @Bean
    public LettucePoolingClientConfiguration lettuceClientConfiguration(
            ClientResources clientResources,
            GenericObjectPoolConfig<?> poolConfig) {

        ClientOptions clientOptions = ClientOptions.builder()
            .autoReconnect(true)
            // 断线期间直接失败，不在客户端排队
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .socketOptions(SocketOptions.builder()
                .connectTimeout(connectTimeout)
                .keepAlive(true)
                .build())
            .build();

        return LettucePoolingClientConfiguration.builder()
            .clientResources(clientResources)
            .clientOptions(clientOptions)
            .poolConfig(poolConfig)
            .commandTimeout(commandTimeout)
            .build();
    }

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(
            LettucePoolingClientConfiguration lettuceClientConfiguration) {

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(host, port);
        if (password != null && !password.isEmpty()) {
            standalone.setPassword(password);
        }

        log.info("Redis configured: {}:{}", host, port);
        return new LettuceConnectionFactory(standalone, lettuceClientConfiguration);
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        return template;
    }
}
