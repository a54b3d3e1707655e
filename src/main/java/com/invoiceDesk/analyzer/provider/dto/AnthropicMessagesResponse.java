package com.invoiceDesk.analyzer.provider.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for the Anthropic Messages API.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnthropicMessagesResponse {
    
    @JsonProperty("id")
    private String id;
    
    @JsonProperty("model")
    private String model;
    
    @JsonProperty("content")
    private List<ContentBlock> content;
    
    @JsonProperty("stop_reason")
    private String stopReason;
    
    @JsonProperty("usage")
    private Usage usage;
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContentBlock {
        @JsonProperty("type")
        private String type; // "text"
        
        @JsonProperty("text")
        private String text;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Usage {
        @JsonProperty("input_tokens")
        private Integer inputTokens;
        
        @JsonProperty("output_tokens")
        private Integer outputTokens;
    }
    
    /**
     * Text of the first content block.
     * 
     * @return Text or null if the response has no content
     */
    public String getText() {
        if (content != null && !content.isEmpty() && content.get(0) != null) {
            return content.get(0).getText();
        }
        return null;
    }
}
