package com.invoiceDesk.analyzer.provider.service;

import com.invoiceDesk.analyzer.provider.model.ProviderRegistration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered list of text-generation providers known to this runtime.
 * 
 * Registrations are fixed at startup; credentials are looked up in the {@link Environment}
 * on every call so a changed key is picked up by the next request.
 */
@Slf4j
public class ProviderRegistry {
    
    private final List<ProviderRegistration> registrations;
    private final Environment environment;
    
    public ProviderRegistry(List<ProviderRegistration> registrations, Environment environment) {
        this.registrations = List.copyOf(registrations);
        this.environment = environment;
        log.info("Provider registry - order: {}", registrations.stream()
                .map(r -> r.getId() + (r.isEnabled() ? "" : " (disabled)"))
                .collect(Collectors.joining(", ")));
    }
    
    public List<ProviderRegistration> getRegistrations() {
        return registrations;
    }
    
    /**
     * Providers that are enabled and currently hold a credential, in registry order.
     */
    public List<UsableProvider> usableProviders() {
        List<UsableProvider> usable = new ArrayList<>();
        for (ProviderRegistration registration : registrations) {
            if (!registration.isEnabled()) {
                continue;
            }
            credentialFor(registration)
                    .ifPresent(apiKey -> usable.add(new UsableProvider(registration, apiKey)));
        }
        return usable;
    }
    
    /**
     * Setup hints for every enabled provider, e.g. "Claude (set ANTHROPIC_API_KEY)".
     */
    public List<String> describeEnableable() {
        return registrations.stream()
                .filter(ProviderRegistration::isEnabled)
                .map(ProviderRegistration::describeSetup)
                .collect(Collectors.toList());
    }
    
    private Optional<String> credentialFor(ProviderRegistration registration) {
        String value = environment.getProperty(registration.getCredentialVariable());
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
    
    /**
     * A registration paired with the credential read for the current dispatch.
     */
    public record UsableProvider(ProviderRegistration registration, String apiKey) {}
}
