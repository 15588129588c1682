package com.thevig.backend.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.transaction.TransactionAwareCacheManagerProxy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String DRAFT_SETTINGS_CACHE = "draft-settings";
    public static final String POOL_CATALOG_CACHE = "pool-catalog";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();

        // Settings change rarely and every write evicts its entry
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(1000)
                .expireAfterWrite(Duration.ofMinutes(10))
                .recordStats());

        cacheManager.setCacheNames(List.of(
                DRAFT_SETTINGS_CACHE,
                POOL_CATALOG_CACHE));

        // Evictions inside a transaction run after it commits
        return new TransactionAwareCacheManagerProxy(cacheManager);
    }
}
