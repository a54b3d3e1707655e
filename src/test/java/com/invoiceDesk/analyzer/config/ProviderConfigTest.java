package com.invoiceDesk.analyzer.config;

import com.invoiceDesk.analyzer.provider.client.TextGenerationProvider;
import com.invoiceDesk.analyzer.provider.exception.ProviderRequestException;
import com.invoiceDesk.analyzer.provider.model.ProviderRegistration;
import com.invoiceDesk.analyzer.provider.service.ProviderRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.env.MockEnvironment;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class ProviderConfigTest {

    @Mock private TextGenerationProvider anthropic;
    @Mock private TextGenerationProvider openai;

    private final ProviderConfig config = new ProviderConfig();
    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        lenient().when(anthropic.getId()).thenReturn("anthropic");
        lenient().when(anthropic.getDefaultCredentialVariable()).thenReturn("ANTHROPIC_API_KEY");
        lenient().when(openai.getId()).thenReturn("openai");
        lenient().when(openai.getDefaultCredentialVariable()).thenReturn("OPENAI_API_KEY");
    }

    @Test
    void providerRegistry_shouldFollowConfiguredOrder() {
        ProviderRegistry registry = config.providerRegistry(List.of(anthropic, openai), environment, List.of("openai", " anthropic"));

        assertThat(registry.getRegistrations()).extracting(ProviderRegistration::getId)
                .containsExactly("openai", "anthropic");
    }

    @Test
    void providerRegistry_shouldApplyEnabledFlagAndCredentialOverride() {
        environment.setProperty("analyzer.providers.anthropic.enabled", "false");
        environment.setProperty("analyzer.providers.openai.credential-variable", "AZURE_OPENAI_KEY");

        ProviderRegistry registry = config.providerRegistry(List.of(anthropic, openai), environment, List.of("anthropic", "openai"));

        assertThat(registry.getRegistrations())
                .extracting(ProviderRegistration::isEnabled, ProviderRegistration::getCredentialVariable)
                .containsExactly(
                        tuple(false, "ANTHROPIC_API_KEY"),
                        tuple(true, "AZURE_OPENAI_KEY"));
    }

    @Test
    void providerRegistry_shouldRejectUnknownProvider() {
        assertThatThrownBy(() -> config.providerRegistry(List.of(anthropic), environment, List.of("anthropic", "gemini")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("gemini");
    }

    @Test
    void providerBackoff_shouldDoubleUpToTheCap() {
        IntervalFunction backoff = config.providerBackoff(Duration.ofSeconds(4), 2.0, Duration.ofSeconds(10));

        assertThat(backoff.apply(1)).isEqualTo(4000L);
        assertThat(backoff.apply(2)).isEqualTo(8000L);
        assertThat(backoff.apply(3)).isEqualTo(10000L);
    }

    @Test
    void providerRetryRegistry_shouldRetryOnlyTransientFailures() {
        IntervalFunction backoff = config.providerBackoff(Duration.ofSeconds(4), 2.0, Duration.ofSeconds(10));

        RetryConfig retryConfig = config.providerRetryRegistry(backoff, 3).getDefaultConfig();

        assertThat(retryConfig.getMaxAttempts()).isEqualTo(3);
        assertThat(retryConfig.getExceptionPredicate().test(new ProviderRequestException("HTTP 503", true))).isTrue();
        assertThat(retryConfig.getExceptionPredicate().test(new ProviderRequestException("HTTP 401", false))).isFalse();
    }
}
