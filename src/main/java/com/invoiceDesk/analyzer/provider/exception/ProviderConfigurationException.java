package com.invoiceDesk.analyzer.provider.exception;

/**
 * Exception thrown when no provider is both enabled and holding a credential.
 */
public class ProviderConfigurationException extends RuntimeException {
    
    public ProviderConfigurationException(String message) {
        super(message);
    }
}
