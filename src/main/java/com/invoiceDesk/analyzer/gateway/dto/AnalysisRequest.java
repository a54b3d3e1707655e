package com.invoiceDesk.analyzer.gateway.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for both analysis endpoints.
 * When datasetText is absent the persisted dataset is used.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {
    
    @NotBlank(message = "query cannot be blank")
    private String query;
    
    /**
     * Optional inline CSV dataset (header plus rows). Also accepted as "csv_data".
     */
    @JsonAlias("csv_data")
    private String datasetText;
    
    public boolean hasInlineDataset() {
        return datasetText != null && !datasetText.isEmpty();
    }
}
