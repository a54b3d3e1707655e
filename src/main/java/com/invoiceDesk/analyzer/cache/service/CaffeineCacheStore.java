package com.invoiceDesk.analyzer.cache.service;

import com.invoiceDesk.analyzer.cache.model.CachedResponse;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link CacheStore} backed by a bounded Caffeine cache.
 * 
 * Entries are evicted once the store exceeds its maximum size or when they are older than
 * the configured write TTL.
 */
@Slf4j
public class CaffeineCacheStore implements CacheStore {
    
    private final Cache<String, CachedResponse> responses;
    
    public CaffeineCacheStore(long maximumSize, Duration expireAfterWrite) {
        this.responses = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(expireAfterWrite)
                .removalListener((String key, CachedResponse value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.debug("Cached analysis evicted - ref: {}, cause: {}",
                                value != null ? value.getFingerprintPrefix() : "unknown", cause);
                    }
                })
                .build();
        log.info("Analysis cache initialised - maximumSize: {}, expireAfterWrite: {}", maximumSize, expireAfterWrite);
    }
    
    @Override
    public Optional<CachedResponse> get(String key) {
        return Optional.ofNullable(responses.getIfPresent(key));
    }
    
    @Override
    public void put(String key, CachedResponse response) {
        responses.put(key, response);
    }
    
    @Override
    public long size() {
        responses.cleanUp();
        return responses.estimatedSize();
    }
}
