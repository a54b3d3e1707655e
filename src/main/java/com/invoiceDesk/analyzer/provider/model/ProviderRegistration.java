package com.invoiceDesk.analyzer.provider.model;

import com.invoiceDesk.analyzer.provider.client.TextGenerationProvider;
import lombok.Builder;
import lombok.Value;

/**
 * Entry of the provider registry built at startup.
 */
@Value
@Builder
public class ProviderRegistration {
    
    TextGenerationProvider provider;
    
    /**
     * Whether the provider is switched on in this runtime (analyzer.providers.&lt;id&gt;.enabled).
     */
    boolean enabled;
    
    /**
     * Environment variable holding the API key; read on every dispatch.
     */
    String credentialVariable;
    
    public String getId() {
        return provider.getId();
    }
    
    /**
     * Human-readable hint, e.g. "Claude (set ANTHROPIC_API_KEY)".
     */
    public String describeSetup() {
        return provider.getDisplayName() + " (set " + credentialVariable + ")";
    }
}
