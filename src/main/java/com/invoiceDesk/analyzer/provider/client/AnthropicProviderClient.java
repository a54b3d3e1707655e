package com.invoiceDesk.analyzer.provider.client;

import com.invoiceDesk.analyzer.provider.dto.AnthropicMessagesRequest;
import com.invoiceDesk.analyzer.provider.dto.AnthropicMessagesResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Client for the Anthropic Messages API.
 */
@Slf4j
@Component
public class AnthropicProviderClient extends AbstractRestProviderClient {
    
    public static final String ID = "anthropic";
    
    private static final String MESSAGES_PATH = "/v1/messages";
    private static final String API_VERSION = "2023-06-01";
    
    private final RestClient restClient;
    private final String model;
    private final Integer maxTokens;
    private final Double temperature;
    
    public AnthropicProviderClient(RestClient.Builder restClientBuilder,
                                   @Value("${analyzer.providers.anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                                   @Value("${analyzer.providers.anthropic.model:claude-3-haiku-20240307}") String model,
                                   @Value("${analyzer.providers.anthropic.max-tokens:500}") Integer maxTokens,
                                   @Value("${analyzer.providers.anthropic.temperature:0.1}") Double temperature) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("anthropic-version", API_VERSION)
                .build();
        this.model = model;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }
    
    @Override
    public String getId() {
        return ID;
    }
    
    @Override
    public String getDisplayName() {
        return "Claude";
    }
    
    @Override
    public String getDefaultCredentialVariable() {
        return "ANTHROPIC_API_KEY";
    }
    
    @Override
    public String complete(String systemPrompt, String prompt, String apiKey) {
        AnthropicMessagesRequest request = AnthropicMessagesRequest.builder()
                .model(model)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .system(systemPrompt)
                .messages(List.of(AnthropicMessagesRequest.Message.builder()
                        .role("user")
                        .content(prompt)
                        .build()))
                .build();
        
        log.debug("Calling Claude API - model: {}, prompt length: {}", model, prompt.length());
        
        return execute(() -> {
            AnthropicMessagesResponse response = restClient.post()
                    .uri(MESSAGES_PATH)
                    .header("x-api-key", apiKey)
                    .body(request)
                    .retrieve()
                    .body(AnthropicMessagesResponse.class);
            
            if (response == null) {
                return null;
            }
            log.debug("Claude API response received - model: {}, output tokens: {}",
                    response.getModel(),
                    response.getUsage() != null ? response.getUsage().getOutputTokens() : "unknown");
            return response.getText();
        });
    }
}
