package com.thevig.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redis is used for the per-draft pick lock (Redisson) and for publishing
 * draft events to the standings broadcast subsystem (StringRedisTemplate,
 * auto-configured by Spring Boot).
 */
@Slf4j
@Configuration
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    @Value("${spring.data.redis.ssl.enabled:false}")
    private boolean redisSsl;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        String address = (redisSsl ? "rediss://" : "redis://") + redisHost + ":" + redisPort;
        log.info("🔧 [RedisConfig] Connecting RedissonClient to {}", address);

        Config config = new Config();
        config.useSingleServer()
                .setAddress(address)
                .setPassword(redisPassword.isEmpty() ? null : redisPassword)
                .setConnectionMinimumIdleSize(2)
                .setConnectionPoolSize(8)
                .setTimeout(3000)
                .setRetryAttempts(3)
                .setRetryInterval(1500)
                .setKeepAlive(true);

        RedissonClient client = Redisson.create(config);
        log.info("✅ [RedisConfig] RedissonClient ready");
        return client;
    }
}
