package com.invoiceDesk.analyzer.provider.client;

import com.invoiceDesk.analyzer.provider.dto.OpenAiChatRequest;
import com.invoiceDesk.analyzer.provider.dto.OpenAiChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Client for the OpenAI chat completions endpoint.
 */
@Slf4j
@Component
public class OpenAiProviderClient extends AbstractRestProviderClient {
    
    public static final String ID = "openai";
    
    private static final String COMPLETIONS_PATH = "/v1/chat/completions";
    
    private final RestClient restClient;
    private final String model;
    private final Integer maxTokens;
    private final Double temperature;
    
    public OpenAiProviderClient(RestClient.Builder restClientBuilder,
                                @Value("${analyzer.providers.openai.base-url:https://api.openai.com}") String baseUrl,
                                @Value("${analyzer.providers.openai.model:gpt-3.5-turbo}") String model,
                                @Value("${analyzer.providers.openai.max-tokens:500}") Integer maxTokens,
                                @Value("${analyzer.providers.openai.temperature:0.1}") Double temperature) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
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
        return "OpenAI";
    }
    
    @Override
    public String getDefaultCredentialVariable() {
        return "OPENAI_API_KEY";
    }
    
    @Override
    public String complete(String systemPrompt, String prompt, String apiKey) {
        OpenAiChatRequest request = OpenAiChatRequest.builder()
                .model(model)
                .messages(List.of(
                        OpenAiChatRequest.Message.builder()
                                .role("system")
                                .content(systemPrompt)
                                .build(),
                        OpenAiChatRequest.Message.builder()
                                .role("user")
                                .content(prompt)
                                .build()
                ))
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();
        
        log.debug("Calling OpenAI API - model: {}, prompt length: {}", model, prompt.length());
        
        return execute(() -> {
            OpenAiChatResponse response = restClient.post()
                    .uri(COMPLETIONS_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(OpenAiChatResponse.class);
            
            if (response == null) {
                return null;
            }
            log.debug("OpenAI API response received - model: {}, tokens used: {}",
                    response.getModel(),
                    response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");
            return response.getContent();
        });
    }
}
