package com.eatsense.cache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 缓存核心服务启动类
 */
@SpringBootApplication
@EnableScheduling
public class CacheCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(CacheCoreApplication.class, args);
    }
}
