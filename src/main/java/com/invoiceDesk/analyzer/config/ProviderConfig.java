package com.invoiceDesk.analyzer.config;

import com.invoiceDesk.analyzer.provider.client.TextGenerationProvider;
import com.invoiceDesk.analyzer.provider.model.ProviderRegistration;
import com.invoiceDesk.analyzer.provider.service.ExternalAnalysisDispatcher;
import com.invoiceDesk.analyzer.provider.service.FallbackPolicy;
import com.invoiceDesk.analyzer.provider.service.ProviderRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wires the provider registry, the retry policy and the dispatcher from the analyzer.providers and analyzer.retry settings.
 */
@Configuration
public class ProviderConfig {
    
    @Bean
    public ProviderRegistry providerRegistry(List<TextGenerationProvider> providers,
                                             Environment environment,
                                             @Value("${analyzer.providers.order:anthropic,openai}") List<String> order) {
        Map<String, TextGenerationProvider> byId = providers.stream()
                .collect(Collectors.toMap(TextGenerationProvider::getId, Function.identity()));
        
        List<ProviderRegistration> registrations = new ArrayList<>();
        for (String rawId : order) {
            String id = rawId.trim();
            TextGenerationProvider provider = byId.get(id);
            if (provider == null) {
                throw new IllegalStateException("Unknown provider '" + id + "' in analyzer.providers.order, known: " + byId.keySet());
            }
            registrations.add(ProviderRegistration.builder()
                    .provider(provider)
                    .enabled(environment.getProperty("analyzer.providers." + id + ".enabled", Boolean.class, true))
                    .credentialVariable(environment.getProperty("analyzer.providers." + id + ".credential-variable",
                            provider.getDefaultCredentialVariable()))
                    .build());
        }
        return new ProviderRegistry(registrations, environment);
    }
    
    @Bean
    public IntervalFunction providerBackoff(@Value("${analyzer.retry.initial-interval:4s}") Duration initialInterval,
                                            @Value("${analyzer.retry.multiplier:2.0}") double multiplier,
                                            @Value("${analyzer.retry.max-interval:10s}") Duration maxInterval) {
        return IntervalFunction.ofExponentialBackoff(initialInterval.toMillis(), multiplier, maxInterval.toMillis());
    }
    
    /**
     * Retry policy shared by all providers; each provider gets its own named {@code Retry} from this registry.
     */
    @Bean
    public RetryRegistry providerRetryRegistry(IntervalFunction providerBackoff,
                                               @Value("${analyzer.retry.max-attempts:3}") int maxAttempts) {
        return RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(providerBackoff)
                .retryOnException(FallbackPolicy::isTransient)
                .build());
    }
    
    @Bean
    public ExternalAnalysisDispatcher externalAnalysisDispatcher(ProviderRegistry providerRegistry,
                                                                 RetryRegistry providerRetryRegistry) {
        return new ExternalAnalysisDispatcher(providerRegistry, providerRetryRegistry);
    }
}
