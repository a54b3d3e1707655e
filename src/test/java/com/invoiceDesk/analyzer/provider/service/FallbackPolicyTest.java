package com.invoiceDesk.analyzer.provider.service;

import com.invoiceDesk.analyzer.provider.exception.ProviderRequestException;
import com.invoiceDesk.analyzer.provider.model.AttemptOutcome;
import com.invoiceDesk.analyzer.provider.model.DispatchDecision;
import com.invoiceDesk.analyzer.provider.model.ProviderAttempt;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackPolicyTest {

    private static ProviderAttempt attempt(int number, AttemptOutcome outcome) {
        return ProviderAttempt.builder()
                .providerId("anthropic")
                .attemptNumber(number)
                .outcome(outcome)
                .build();
    }

    @Test
    void decide_shouldCompleteOnSuccess() {
        assertThat(FallbackPolicy.decide(attempt(2, AttemptOutcome.SUCCESS))).isEqualTo(DispatchDecision.COMPLETE);
    }

    @Test
    void decide_shouldMoveOnAfterExhaustedTransientFailures() {
        assertThat(FallbackPolicy.decide(attempt(3, AttemptOutcome.TRANSIENT_FAILURE)))
                .isEqualTo(DispatchDecision.NEXT_PROVIDER);
    }

    @Test
    void decide_shouldMoveOnAfterTerminalFailure() {
        assertThat(FallbackPolicy.decide(attempt(1, AttemptOutcome.TERMINAL_FAILURE)))
                .isEqualTo(DispatchDecision.NEXT_PROVIDER);
    }

    @Test
    void isTransient_shouldFollowRetryableFlag() {
        assertThat(FallbackPolicy.isTransient(new ProviderRequestException("Claude API error: HTTP 503", true))).isTrue();
        assertThat(FallbackPolicy.isTransient(new ProviderRequestException("Claude API error: HTTP 401", false))).isFalse();
    }

    @Test
    void isTransient_shouldRejectOtherExceptions() {
        assertThat(FallbackPolicy.isTransient(new IllegalStateException("boom"))).isFalse();
        assertThat(FallbackPolicy.isTransient(null)).isFalse();
    }
}
