package com.invoiceDesk.analyzer.gateway.service;

import com.invoiceDesk.analyzer.analysis.service.AnalysisCoordinator;
import com.invoiceDesk.analyzer.cache.model.CachedResponse;
import com.invoiceDesk.analyzer.dataset.model.RecordSet;
import com.invoiceDesk.analyzer.dataset.service.InvoiceCsvParser;
import com.invoiceDesk.analyzer.dataset.service.InvoiceDatasetRepository;
import com.invoiceDesk.analyzer.dataset.service.InvoiceDatasetRepository.PersistedDataset;
import com.invoiceDesk.analyzer.gateway.dto.AnalysisRequest;
import com.invoiceDesk.analyzer.gateway.dto.AnalysisResponse;
import com.invoiceDesk.analyzer.gateway.dto.HealthResponse;
import com.invoiceDesk.analyzer.gateway.dto.InvoiceListResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Gateway service - handles the request-level logic behind the HTTP endpoints.
 * 
 * Responsibilities:
 * - Resolve the dataset of a request (inline CSV or the persisted file)
 * - Delegate to the AnalysisCoordinator
 * - Map results to response DTOs
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisGatewayService {
    
    private final InvoiceCsvParser csvParser;
    private final InvoiceDatasetRepository datasetRepository;
    private final AnalysisCoordinator coordinator;
    
    /**
     * Provider-backed analysis.
     * 
     * @param request Query and optional inline dataset
     * @return Analysis response
     */
    public AnalysisResponse analyzeWithProvider(AnalysisRequest request) {
        String requestId = newRequestId();
        ResolvedDataset dataset = resolveDataset(request);
        log.info("Provider analysis requested - requestId: {}, origin: {}, records: {}, query length: {}",
                requestId, dataset.records().getOrigin(), dataset.records().size(), request.getQuery().length());
        
        CachedResponse response = coordinator.analyzeViaProvider(request.getQuery(), dataset.rawText(), dataset.records());
        
        log.info("Provider analysis returned - requestId: {}, ref: {}", requestId, response.getFingerprintPrefix());
        return toResponse(response);
    }
    
    /**
     * Heuristic (local, free) analysis.
     * 
     * @param request Query and optional inline dataset
     * @return Analysis response
     */
    public AnalysisResponse analyzeWithHeuristic(AnalysisRequest request) {
        String requestId = newRequestId();
        ResolvedDataset dataset = resolveDataset(request);
        log.info("Heuristic analysis requested - requestId: {}, origin: {}, records: {}, query length: {}",
                requestId, dataset.records().getOrigin(), dataset.records().size(), request.getQuery().length());
        
        CachedResponse response = coordinator.analyzeViaHeuristic(request.getQuery(), dataset.rawText(), dataset.records());
        
        log.info("Heuristic analysis returned - requestId: {}, ref: {}", requestId, response.getFingerprintPrefix());
        return toResponse(response);
    }
    
    /**
     * Lists the records of the persisted dataset; empty if there is none.
     */
    public InvoiceListResponse listInvoices() {
        RecordSet records = datasetRepository.load().records();
        return InvoiceListResponse.builder()
                .records(records.getRecords())
                .count(records.size())
                .build();
    }
    
    public HealthResponse health() {
        return HealthResponse.builder()
                .status("healthy")
                .cacheSize(coordinator.cacheSize())
                .build();
    }
    
    private ResolvedDataset resolveDataset(AnalysisRequest request) {
        if (request.hasInlineDataset()) {
            return new ResolvedDataset(request.getDatasetText(), csvParser.parseInline(request.getDatasetText()));
        }
        PersistedDataset persisted = datasetRepository.load();
        return new ResolvedDataset(persisted.rawText(), persisted.records());
    }
    
    private AnalysisResponse toResponse(CachedResponse response) {
        return AnalysisResponse.builder()
                .analysis(response.getAnalysisText())
                .recordsAnalyzed(response.getRecordCount())
                .fingerprintPrefix(response.getFingerprintPrefix())
                .build();
    }
    
    private String newRequestId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
    
    private record ResolvedDataset(String rawText, RecordSet records) {}
}
