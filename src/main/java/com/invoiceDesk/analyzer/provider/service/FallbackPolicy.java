package com.invoiceDesk.analyzer.provider.service;

import com.invoiceDesk.analyzer.provider.exception.ProviderRequestException;
import com.invoiceDesk.analyzer.provider.model.AttemptOutcome;
import com.invoiceDesk.analyzer.provider.model.DispatchDecision;
import com.invoiceDesk.analyzer.provider.model.ProviderAttempt;

/**
 * Retry and fallback rules of the dispatcher. Pure, no side effects.
 */
public final class FallbackPolicy {
    
    private FallbackPolicy() {
    }
    
    /**
     * Whether a failed call is worth another attempt against the same provider.
     * Used as the retry predicate of every provider's {@code Retry}.
     */
    public static boolean isTransient(Throwable failure) {
        return failure instanceof ProviderRequestException requestFailure && requestFailure.isRetryable();
    }
    
    /**
     * @param latest Last attempt against the current provider, after its retries are used up
     * @return COMPLETE on success, NEXT_PROVIDER otherwise
     */
    public static DispatchDecision decide(ProviderAttempt latest) {
        return latest.getOutcome() == AttemptOutcome.SUCCESS
                ? DispatchDecision.COMPLETE
                : DispatchDecision.NEXT_PROVIDER;
    }
}
