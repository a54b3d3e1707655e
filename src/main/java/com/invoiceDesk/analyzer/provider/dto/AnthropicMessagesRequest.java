package com.invoiceDesk.analyzer.provider.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for the Anthropic Messages API.
 * The system prompt is a top-level field, not a message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnthropicMessagesRequest {
    
    @JsonProperty("model")
    private String model;
    
    @JsonProperty("max_tokens")
    private Integer maxTokens;
    
    @JsonProperty("temperature")
    private Double temperature;
    
    @JsonProperty("system")
    private String system;
    
    @JsonProperty("messages")
    private List<Message> messages;
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Message {
        @JsonProperty("role")
        private String role;
        
        @JsonProperty("content")
        private String content;
    }
}
