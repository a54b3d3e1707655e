package com.invoiceDesk.analyzer.analysis.service;

import com.invoiceDesk.analyzer.cache.model.CachedResponse;
import com.invoiceDesk.analyzer.cache.service.CaffeineCacheStore;
import com.invoiceDesk.analyzer.cache.util.RequestFingerprint;
import com.invoiceDesk.analyzer.dataset.exception.DatasetNotFoundException;
import com.invoiceDesk.analyzer.dataset.model.DatasetOrigin;
import com.invoiceDesk.analyzer.dataset.model.InvoiceRecord;
import com.invoiceDesk.analyzer.dataset.model.RecordSet;
import com.invoiceDesk.analyzer.heuristic.service.HeuristicAnalyzer;
import com.invoiceDesk.analyzer.provider.exception.ProviderCallException;
import com.invoiceDesk.analyzer.provider.model.DispatchResult;
import com.invoiceDesk.analyzer.provider.service.ExternalAnalysisDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisCoordinatorTest {

    private static final String CSV = "invoice_id,customer,amount,paid_at,status\n"
            + "INV-1,Acme,100.00,2024-01-05,Paid\n"
            + "INV-2,Globex,200.00,2024-01-09,Partially Paid\n";

    @Mock private ExternalAnalysisDispatcher dispatcher;

    private CaffeineCacheStore cacheStore;
    private AnalysisCoordinator coordinator;
    private RecordSet records;

    @BeforeEach
    void setUp() {
        cacheStore = new CaffeineCacheStore(100, Duration.ofHours(1));
        coordinator = new AnalysisCoordinator(cacheStore, new HeuristicAnalyzer(true), dispatcher);
        records = new RecordSet(List.of(
                invoice("INV-1", "Acme", "100.00", "Paid"),
                invoice("INV-2", "Globex", "200.00", "Partially Paid")
        ), DatasetOrigin.INLINE);
    }

    private static InvoiceRecord invoice(String id, String customer, String amount, String status) {
        return InvoiceRecord.builder()
                .id(id)
                .customer(customer)
                .amount(amount)
                .paidAt("2024-01-05")
                .status(status)
                .build();
    }

    private static DispatchResult dispatched(String text) {
        return DispatchResult.builder().text(text).providerId("anthropic").attempts(List.of()).build();
    }

    @Test
    void analyzeViaProvider_shouldServeRepeatedQueryFromCache() {
        when(dispatcher.dispatch(anyString())).thenReturn(dispatched("Revenue is $300.00."));

        CachedResponse first = coordinator.analyzeViaProvider("total revenue?", CSV, records);
        CachedResponse second = coordinator.analyzeViaProvider("total revenue?", CSV, records);

        assertThat(second.getAnalysisText()).isEqualTo(first.getAnalysisText()).isEqualTo("Revenue is $300.00.");
        assertThat(second.getRecordCount()).isEqualTo(2);
        assertThat(second.getFingerprintPrefix()).isEqualTo(RequestFingerprint.of("total revenue?", CSV).substring(0, 8));
        verify(dispatcher, times(1)).dispatch(anyString());
    }

    @Test
    void analyzeViaProvider_shouldSendBoundedSummaryAndQuery() {
        when(dispatcher.dispatch(anyString())).thenReturn(dispatched("ok"));

        coordinator.analyzeViaProvider("who pays late?", CSV, records);

        verify(dispatcher).dispatch(contains("User Query: who pays late?"));
        verify(dispatcher).dispatch(contains("1. Invoice INV-1: Acme, $100.00, Paid, Paid: 2024-01-05"));
    }

    @Test
    void analyzeViaProvider_shouldDispatchAgainForDifferentDataset() {
        when(dispatcher.dispatch(anyString())).thenReturn(dispatched("a"), dispatched("b"));

        coordinator.analyzeViaProvider("total revenue?", CSV, records);
        CachedResponse other = coordinator.analyzeViaProvider("total revenue?", CSV + "INV-3,Initech,5.00,,Paid\n", records);

        assertThat(other.getAnalysisText()).isEqualTo("b");
        verify(dispatcher, times(2)).dispatch(anyString());
    }

    @Test
    void providerAndHeuristicAnswersShouldBeCachedSeparately() {
        when(dispatcher.dispatch(anyString())).thenReturn(dispatched("provider text"));

        CachedResponse provider = coordinator.analyzeViaProvider("total revenue?", CSV, records);
        CachedResponse heuristic = coordinator.analyzeViaHeuristic("total revenue?", CSV, records);

        assertThat(provider.getAnalysisText()).isEqualTo("provider text");
        assertThat(heuristic.getAnalysisText()).startsWith("Total Revenue Analysis:");
        assertThat(provider.getFingerprintPrefix()).isEqualTo(heuristic.getFingerprintPrefix());
        assertThat(coordinator.cacheSize()).isEqualTo(2);
    }

    @Test
    void analyzeViaHeuristic_shouldNotCallDispatcher() {
        CachedResponse response = coordinator.analyzeViaHeuristic("how many invoices?", CSV, records);

        assertThat(response.getAnalysisText()).startsWith("Invoice Count Analysis:");
        verifyNoInteractions(dispatcher);
    }

    @Test
    void failedDispatchShouldNotBeCached() {
        when(dispatcher.dispatch(anyString()))
                .thenThrow(new ProviderCallException("Claude API error: HTTP 503", List.of()))
                .thenReturn(dispatched("second time lucky"));

        assertThatThrownBy(() -> coordinator.analyzeViaProvider("total revenue?", CSV, records))
                .isInstanceOf(ProviderCallException.class);
        assertThat(coordinator.cacheSize()).isZero();

        CachedResponse retried = coordinator.analyzeViaProvider("total revenue?", CSV, records);
        assertThat(retried.getAnalysisText()).isEqualTo("second time lucky");
    }

    @Test
    void emptyInlineDatasetShouldBeReportedAsUnusable() {
        assertThatThrownBy(() -> coordinator.analyzeViaHeuristic("revenue", "id\n", RecordSet.empty(DatasetOrigin.INLINE)))
                .isInstanceOfSatisfying(DatasetNotFoundException.class, e ->
                        assertThat(e.getReason()).isEqualTo(DatasetNotFoundException.Reason.UNUSABLE_SUPPLIED_DATASET));
        verifyNoInteractions(dispatcher);
    }

    @Test
    void missingPersistedDatasetShouldBeReportedAsNotFound() {
        assertThatThrownBy(() -> coordinator.analyzeViaProvider("revenue", "", RecordSet.empty(DatasetOrigin.PERSISTED)))
                .isInstanceOfSatisfying(DatasetNotFoundException.class, e ->
                        assertThat(e.getReason()).isEqualTo(DatasetNotFoundException.Reason.NO_PERSISTED_DATASET));
        assertThat(coordinator.cacheSize()).isZero();
        verifyNoInteractions(dispatcher);
    }
}
