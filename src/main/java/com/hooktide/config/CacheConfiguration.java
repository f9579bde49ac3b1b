package com.hooktide.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hooktide.model.EnrichmentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cache of successful registry lookups, keyed by normalized repository key.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    @Bean
    public Cache<String, EnrichmentRecord> enrichmentCache(HooktideProperties properties) {
        HooktideProperties.Cache cache = properties.getRegistry().getCache();
        log.info("Enrichment cache: enabled={}, ttl={}, maxSize={}",
                cache.isEnabled(), cache.getTtl(), cache.getMaxSize());
        return Caffeine.newBuilder()
                .maximumSize(cache.getMaxSize())
                .expireAfterWrite(cache.getTtl())
                .removalListener((key, value, cause) -> {
                    if (cause.wasEvicted()) {
                        log.debug("Enrichment entry evicted: key={}, cause={}", key, cause);
                    }
                })
                .build();
    }
}
