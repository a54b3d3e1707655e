package com.invoiceDesk.analyzer.provider.model;

import lombok.Builder;
import lombok.Value;

/**
 * Record of one call to one provider within a single dispatch.
 */
@Value
@Builder
public class ProviderAttempt {
    
    String providerId;
    
    /**
     * 1-based attempt number against this provider.
     */
    int attemptNumber;
    
    AttemptOutcome outcome;
    
    /**
     * Failure description, null on success.
     */
    String failureMessage;
}
