package com.invoiceDesk.analyzer.cache.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of an analysis as stored in the idempotency cache.
 * Immutable; a repeated request receives this exact instance.
 */
@Value
@Builder
public class CachedResponse {
    
    String analysisText;
    
    int recordCount;
    
    /**
     * Short reference to the request fingerprint (first 8 hex characters).
     */
    String fingerprintPrefix;
}
