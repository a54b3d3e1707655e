package com.invoiceDesk.analyzer.cache.service;

import com.invoiceDesk.analyzer.cache.model.CachedResponse;

import java.util.Optional;

/**
 * Idempotency cache mapping a request key to a previously computed response.
 * Implementations must be safe for concurrent use; the last put for a key wins.
 */
public interface CacheStore {
    
    Optional<CachedResponse> get(String key);
    
    void put(String key, CachedResponse response);
    
    long size();
}
