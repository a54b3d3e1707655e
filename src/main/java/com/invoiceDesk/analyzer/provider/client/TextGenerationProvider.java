package com.invoiceDesk.analyzer.provider.client;

import com.invoiceDesk.analyzer.provider.exception.ProviderRequestException;

/**
 * An external text-generation service.
 */
public interface TextGenerationProvider {
    
    /**
     * Stable identifier used in configuration, e.g. "anthropic".
     */
    String getId();
    
    /**
     * Name shown in error messages, e.g. "Claude".
     */
    String getDisplayName();
    
    /**
     * Environment variable that holds this provider's API key.
     */
    String getDefaultCredentialVariable();
    
    /**
     * Generates a completion for a single user prompt.
     * 
     * @param systemPrompt Instructions for the model
     * @param prompt User prompt
     * @param apiKey Credential read for this call
     * @return Generated text, never blank
     * @throws ProviderRequestException if the call fails
     */
    String complete(String systemPrompt, String prompt, String apiKey);
}
