package com.invoiceDesk.analyzer.gateway.controller;

import com.invoiceDesk.analyzer.gateway.dto.AnalysisRequest;
import com.invoiceDesk.analyzer.gateway.dto.AnalysisResponse;
import com.invoiceDesk.analyzer.gateway.dto.HealthResponse;
import com.invoiceDesk.analyzer.gateway.dto.InvoiceListResponse;
import com.invoiceDesk.analyzer.gateway.service.AnalysisGatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Invoice analysis REST controller - thin HTTP layer.
 * 
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Validate request bodies
 * - Delegate to AnalysisGatewayService
 */
@RestController
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class AnalysisController {
    
    private final AnalysisGatewayService gatewayService;
    
    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of(
                "message", "Invoice Analyzer API",
                "endpoints", "POST /analyze, POST /analyze-free, GET /invoices, GET /health"));
    }
    
    /**
     * Provider-backed analysis.
     * 
     * @param request Query and optional inline CSV dataset
     * @return Analysis text, number of records analyzed and fingerprint reference
     */
    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(gatewayService.analyzeWithProvider(request));
    }
    
    /**
     * Local heuristic analysis; needs no provider credentials.
     * 
     * @param request Query and optional inline CSV dataset
     * @return Analysis text, number of records analyzed and fingerprint reference
     */
    @PostMapping("/analyze-free")
    public ResponseEntity<AnalysisResponse> analyzeFree(@Valid @RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(gatewayService.analyzeWithHeuristic(request));
    }
    
    @GetMapping("/invoices")
    public ResponseEntity<InvoiceListResponse> invoices() {
        return ResponseEntity.ok(gatewayService.listInvoices());
    }
    
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(gatewayService.health());
    }
}
