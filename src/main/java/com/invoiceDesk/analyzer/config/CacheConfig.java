package com.invoiceDesk.analyzer.config;

import com.invoiceDesk.analyzer.cache.service.CacheStore;
import com.invoiceDesk.analyzer.cache.service.CaffeineCacheStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Idempotency cache bounds.
 */
@Configuration
public class CacheConfig {
    
    @Bean
    public CacheStore analysisCacheStore(@Value("${analyzer.cache.maximum-size:10000}") long maximumSize,
                                         @Value("${analyzer.cache.expire-after-write:24h}") Duration expireAfterWrite) {
        return new CaffeineCacheStore(maximumSize, expireAfterWrite);
    }
}
