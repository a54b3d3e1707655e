package com.invoiceDesk.analyzer.provider.exception;

import lombok.Getter;

/**
 * Exception thrown by a provider client when a single call fails.
 * Carries whether the failure is worth retrying against the same provider.
 */
@Getter
public class ProviderRequestException extends RuntimeException {
    
    private final boolean retryable;
    
    public ProviderRequestException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }
    
    public ProviderRequestException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}
