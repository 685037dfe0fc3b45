package com.company.querylog.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Local Caffeine caches with per-cache TTLs.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String SLOWEST_QUERIES = "slowestQueries";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();

        // Default for ad-hoc caches
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(5))
                .maximumSize(1_000));

        // Slowest-query scans, keyed by scan depth
        cacheManager.registerCustomCache(SLOWEST_QUERIES, Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(60))
                .maximumSize(100)
                .recordStats()
                .build());

        return cacheManager;
    }
}
