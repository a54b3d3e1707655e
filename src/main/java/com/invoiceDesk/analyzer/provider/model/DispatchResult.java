package com.invoiceDesk.analyzer.provider.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Successful dispatch: the generated text and the attempts it took to get it.
 */
@Value
@Builder
public class DispatchResult {
    
    String text;
    
    String providerId;
    
    List<ProviderAttempt> attempts;
}
