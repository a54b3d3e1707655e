package com.invoiceDesk.analyzer.analysis.service;

import com.invoiceDesk.analyzer.cache.model.CachedResponse;
import com.invoiceDesk.analyzer.cache.service.CacheStore;
import com.invoiceDesk.analyzer.cache.service.InFlightRequests;
import com.invoiceDesk.analyzer.cache.util.RequestFingerprint;
import com.invoiceDesk.analyzer.dataset.exception.DatasetNotFoundException;
import com.invoiceDesk.analyzer.dataset.model.DatasetOrigin;
import com.invoiceDesk.analyzer.dataset.model.RecordSet;
import com.invoiceDesk.analyzer.heuristic.service.HeuristicAnalyzer;
import com.invoiceDesk.analyzer.provider.model.DispatchResult;
import com.invoiceDesk.analyzer.provider.prompt.AnalysisPrompt;
import com.invoiceDesk.analyzer.provider.service.ExternalAnalysisDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Coordinates a single analysis request.
 *
 * Workflow (both operations):
 * VALIDATE_RECORDS -> FINGERPRINT -> CACHE_LOOKUP -> (HIT ? RETURN) -> ANALYZE -> STORE -> RETURN
 *
 * Concurrent requests with the same cache key are collapsed into one computation.
 */
@Slf4j
@Service
public class AnalysisCoordinator {

    /**
     * Keeps provider answers apart from heuristic answers for identical inputs.
     */
    static final String PROVIDER_KEY_PREFIX = "llm_";

    private final CacheStore cacheStore;
    private final HeuristicAnalyzer heuristicAnalyzer;
    private final ExternalAnalysisDispatcher dispatcher;
    private final InFlightRequests<CachedResponse> inFlight = new InFlightRequests<>();

    public AnalysisCoordinator(CacheStore cacheStore,
                               HeuristicAnalyzer heuristicAnalyzer,
                               ExternalAnalysisDispatcher dispatcher) {
        this.cacheStore = cacheStore;
        this.heuristicAnalyzer = heuristicAnalyzer;
        this.dispatcher = dispatcher;
    }

    /**
     * Answers a query through the external text-generation providers.
     *
     * @param query User query
     * @param datasetText Literal dataset text the records were parsed from
     * @param records Parsed records
     * @return Cached or freshly computed response
     */
    public CachedResponse analyzeViaProvider(String query, String datasetText, RecordSet records) {
        requireRecords(records);
        String fingerprint = RequestFingerprint.of(query, datasetText);
        return cachedOrCompute(PROVIDER_KEY_PREFIX + fingerprint, fingerprint, records, () -> {
            String prompt = AnalysisPrompt.build(query, records);
            DispatchResult result = dispatcher.dispatch(prompt);
            log.info("Provider analysis completed - ref: {}, provider: {}, attempts: {}",
                    RequestFingerprint.prefix(fingerprint), result.getProviderId(), result.getAttempts().size());
            return result.getText();
        });
    }

    /**
     * Answers a query with the local heuristic analyzer.
     *
     * @param query User query
     * @param datasetText Literal dataset text the records were parsed from
     * @param records Parsed records
     * @return Cached or freshly computed response
     */
    public CachedResponse analyzeViaHeuristic(String query, String datasetText, RecordSet records) {
        requireRecords(records);
        String fingerprint = RequestFingerprint.of(query, datasetText);
        return cachedOrCompute(fingerprint, fingerprint, records,
                () -> heuristicAnalyzer.analyze(query, records));
    }

    public long cacheSize() {
        return cacheStore.size();
    }

    private CachedResponse cachedOrCompute(String cacheKey, String fingerprint, RecordSet records,
                                           Supplier<String> analysis) {
        String ref = RequestFingerprint.prefix(fingerprint);

        Optional<CachedResponse> cached = cacheStore.get(cacheKey);
        if (cached.isPresent()) {
            log.info("Cache hit - ref: {}", ref);
            return cached.get();
        }

        return inFlight.execute(cacheKey, () -> {
            // another request may have stored the result while this one was waiting to start
            Optional<CachedResponse> stored = cacheStore.get(cacheKey);
            if (stored.isPresent()) {
                return stored.get();
            }

            log.info("Cache miss - ref: {}, records: {}", ref, records.size());
            CachedResponse response = CachedResponse.builder()
                    .analysisText(analysis.get())
                    .recordCount(records.size())
                    .fingerprintPrefix(ref)
                    .build();
            cacheStore.put(cacheKey, response);
            return response;
        });
    }

    private void requireRecords(RecordSet records) {
        if (records != null && !records.isEmpty()) {
            return;
        }
        if (records != null && records.getOrigin() == DatasetOrigin.INLINE) {
            throw new DatasetNotFoundException(DatasetNotFoundException.Reason.UNUSABLE_SUPPLIED_DATASET,
                    "The supplied CSV data contains no invoice rows.");
        }
        throw new DatasetNotFoundException(DatasetNotFoundException.Reason.NO_PERSISTED_DATASET,
                "No invoice data found. Provide CSV data or place an invoice export at the configured dataset path.");
    }
}
