package com.invoiceDesk.analyzer.provider.service;

import com.invoiceDesk.analyzer.provider.exception.ProviderCallException;
import com.invoiceDesk.analyzer.provider.exception.ProviderConfigurationException;
import com.invoiceDesk.analyzer.provider.exception.ProviderRequestException;
import com.invoiceDesk.analyzer.provider.model.AttemptOutcome;
import com.invoiceDesk.analyzer.provider.model.DispatchResult;
import com.invoiceDesk.analyzer.provider.model.ProviderAttempt;
import com.invoiceDesk.analyzer.provider.model.ProviderRegistration;
import com.invoiceDesk.analyzer.provider.prompt.AnalysisPrompt;
import com.invoiceDesk.analyzer.provider.service.ProviderRegistry.UsableProvider;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Sends a prompt to the configured text-generation providers.
 *
 * Responsibilities:
 * - Walk the usable providers in registry order
 * - Retry each provider through its own {@link Retry} (named after the provider id) while failures are transient
 * - Fall back to the next provider when one is exhausted or fails terminally
 * - Fail with the full attempt trace once the last provider is exhausted
 *
 * Performs no caching and does not look at the records; the prompt is already bounded.
 */
@Slf4j
public class ExternalAnalysisDispatcher {

    private final ProviderRegistry registry;
    private final RetryRegistry retryRegistry;

    public ExternalAnalysisDispatcher(ProviderRegistry registry, RetryRegistry retryRegistry) {
        this.registry = registry;
        this.retryRegistry = retryRegistry;
        for (ProviderRegistration registration : registry.getRegistrations()) {
            Retry retry = retryRegistry.retry(registration.getId());
            retry.getEventPublisher().onRetry(event -> log.warn(
                    "Provider call failed - provider: {}, attempt: {}/{}, retrying in {} ms, error: {}",
                    event.getName(), event.getNumberOfRetryAttempts(), retry.getRetryConfig().getMaxAttempts(),
                    event.getWaitInterval().toMillis(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        }
    }

    /**
     * Dispatches a prompt with the default analyst system prompt.
     *
     * @param prompt User prompt built from the query and a bounded dataset summary
     * @return Generated text and the attempts it took
     * @throws ProviderConfigurationException if no provider is enabled and holds a credential
     * @throws ProviderCallException if the last usable provider failed
     */
    public DispatchResult dispatch(String prompt) {
        return dispatch(AnalysisPrompt.SYSTEM_PROMPT, prompt);
    }

    public DispatchResult dispatch(String systemPrompt, String prompt) {
        List<UsableProvider> providers = registry.usableProviders();
        if (providers.isEmpty()) {
            throw noProviderAvailable();
        }

        List<ProviderAttempt> trace = new ArrayList<>();
        ProviderRequestException lastFailure = null;

        for (int index = 0; index < providers.size(); index++) {
            UsableProvider current = providers.get(index);
            String providerId = current.registration().getId();
            Retry retry = retryRegistry.retry(providerId);

            try {
                String text = Retry.decorateSupplier(retry, recordingCall(current, systemPrompt, prompt, trace)).get();
                log.info("Provider call succeeded - provider: {}, attempt: {}, totalAttempts: {}",
                        providerId, trace.get(trace.size() - 1).getAttemptNumber(), trace.size());
                return DispatchResult.builder()
                        .text(text)
                        .providerId(providerId)
                        .attempts(List.copyOf(trace))
                        .build();
            } catch (ProviderRequestException e) {
                lastFailure = e;
                ProviderAttempt latest = trace.get(trace.size() - 1);
                log.warn("Provider {} gave up after {} attempt(s) - outcome: {}, next: {}, error: {}",
                        providerId, latest.getAttemptNumber(), latest.getOutcome(),
                        FallbackPolicy.decide(latest), e.getMessage());
            }

            if (index < providers.size() - 1) {
                log.warn("Provider {} exhausted, falling back to {}",
                        providerId, providers.get(index + 1).registration().getId());
            }
        }

        // provider clients already prefix their messages with the provider's display name
        String message = lastFailure != null
                ? lastFailure.getMessage()
                : providers.get(providers.size() - 1).registration().getProvider().getDisplayName() + " API error: no response";
        throw new ProviderCallException(message, trace, lastFailure);
    }

    /**
     * One call to one provider; every invocation, including retries, appends its outcome to the trace.
     * Unexpected runtime failures are reported as transient.
     */
    private Supplier<String> recordingCall(UsableProvider current, String systemPrompt, String prompt,
                                           List<ProviderAttempt> trace) {
        ProviderRegistration registration = current.registration();
        AtomicInteger attemptNumber = new AtomicInteger();
        return () -> {
            int attempt = attemptNumber.incrementAndGet();
            try {
                String text = registration.getProvider().complete(systemPrompt, prompt, current.apiKey());
                trace.add(attempt(registration.getId(), attempt, AttemptOutcome.SUCCESS, null));
                return text;
            } catch (ProviderRequestException e) {
                trace.add(attempt(registration.getId(), attempt,
                        e.isRetryable() ? AttemptOutcome.TRANSIENT_FAILURE : AttemptOutcome.TERMINAL_FAILURE,
                        e.getMessage()));
                throw e;
            } catch (RuntimeException e) {
                trace.add(attempt(registration.getId(), attempt, AttemptOutcome.TRANSIENT_FAILURE, e.getMessage()));
                throw new ProviderRequestException(
                        registration.getProvider().getDisplayName() + " API error: " + e.getMessage(), true, e);
            }
        };
    }

    private ProviderAttempt attempt(String providerId, int attemptNumber, AttemptOutcome outcome, String message) {
        return ProviderAttempt.builder()
                .providerId(providerId)
                .attemptNumber(attemptNumber)
                .outcome(outcome)
                .failureMessage(message)
                .build();
    }

    private ProviderConfigurationException noProviderAvailable() {
        List<String> enableable = registry.describeEnableable();
        String message = enableable.isEmpty()
                ? "No LLM API available. Enable a provider under analyzer.providers"
                : "No LLM API available. Install and configure: " + String.join(", ", enableable);
        log.error(message);
        return new ProviderConfigurationException(message);
    }
}
