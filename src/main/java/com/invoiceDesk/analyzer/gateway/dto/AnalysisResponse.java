package com.invoiceDesk.analyzer.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for both analysis endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisResponse {
    
    private String analysis;
    private int recordsAnalyzed;
    private String fingerprintPrefix; // reference to the request fingerprint, not a secret
}
