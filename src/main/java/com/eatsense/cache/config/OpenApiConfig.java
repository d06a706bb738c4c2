package com.eatsense.cache.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 3.0 文档配置
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("EatSense 缓存服务 API")
                .version("1.0.0")
                .description("""
                    Cache-Aside 缓存运维 API

                    ## 核心特性
                    - 命名空间 TTL 策略，信封内逻辑过期 + 存储端过期双重保障
                    - 占位锁 + 固定间隔轮询防击穿
                    - 按作用域批量失效，定时清理过期条目
                    """)
                .license(new License()
                    .name("Apache 2.0")
                    .url("https://www.apache.org/licenses/LICENSE-2.0")));
    }
}
