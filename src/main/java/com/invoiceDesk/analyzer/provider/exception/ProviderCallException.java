package com.invoiceDesk.analyzer.provider.exception;

import com.invoiceDesk.analyzer.provider.model.ProviderAttempt;
import lombok.Getter;

import java.util.List;

/**
 * Exception thrown when the last usable provider failed and nothing is left to fall back to.
 */
@Getter
public class ProviderCallException extends RuntimeException {
    
    private final List<ProviderAttempt> attempts;
    
    public ProviderCallException(String message, List<ProviderAttempt> attempts) {
        super(message);
        this.attempts = List.copyOf(attempts);
    }
    
    public ProviderCallException(String message, List<ProviderAttempt> attempts, Throwable cause) {
        super(message, cause);
        this.attempts = List.copyOf(attempts);
    }
}
