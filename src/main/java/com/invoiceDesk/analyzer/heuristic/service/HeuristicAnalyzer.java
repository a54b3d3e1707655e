package com.invoiceDesk.analyzer.heuristic.service;

import com.invoiceDesk.analyzer.dataset.exception.DatasetNotFoundException;
import com.invoiceDesk.analyzer.dataset.model.DatasetOrigin;
import com.invoiceDesk.analyzer.dataset.model.RecordSet;
import com.invoiceDesk.analyzer.heuristic.exception.HeuristicUnavailableException;
import com.invoiceDesk.analyzer.heuristic.model.InvoiceAggregates;
import com.invoiceDesk.analyzer.heuristic.model.QueryCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Local, keyword-driven invoice summarizer.
 *
 * Responsibilities:
 * - Classify the query into a {@link QueryCategory}
 * - Compute aggregates over the records
 * - Render a deterministic financial-report style summary
 *
 * Makes no external calls; the same query and records always produce the same text.
 */
@Slf4j
@Service
public class HeuristicAnalyzer {

    static final int TOP_CUSTOMER_LIMIT = 5;

    private final boolean enabled;

    public HeuristicAnalyzer(@Value("${analyzer.heuristic.enabled:true}") boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Produces the summary for a query.
     *
     * @param query Free-text query
     * @param records Records to summarize
     * @return Analysis text
     * @throws HeuristicUnavailableException if the analyzer is disabled
     * @throws DatasetNotFoundException if there are no records to divide by
     */
    public String analyze(String query, RecordSet records) {
        if (!enabled) {
            throw new HeuristicUnavailableException("Heuristic analyzer is disabled (analyzer.heuristic.enabled=false)");
        }
        if (records.isEmpty()) {
            throw noRecords(records.getOrigin());
        }

        QueryCategory category = QueryCategory.classify(query);
        InvoiceAggregates aggregates = InvoiceAggregates.of(records);

        log.debug("Heuristic analysis - category: {}, records: {}, customers: {}",
                category, aggregates.getTotal(), aggregates.getUniqueCustomers().size());

        return switch (category) {
            case REVENUE -> revenueSummary(aggregates);
            case CUSTOMERS -> customerRanking(aggregates);
            case PAYMENT_STATUS -> paymentStatusSummary(aggregates);
            case COUNT -> countSummary(aggregates);
            case OVERVIEW -> overview(aggregates);
        };
    }

    private String revenueSummary(InvoiceAggregates aggregates) {
        return "Total Revenue Analysis:\n"
                + "- Total invoices: " + aggregates.getTotal() + "\n"
                + "- Total amount: " + currency(aggregates.getSumAmount()) + "\n"
                + "- Paid invoices: " + aggregates.getPaidCount() + "\n"
                + "- Partially paid: " + aggregates.getPartialCount() + "\n"
                + "- Average per invoice: " + currency(averageAmount(aggregates));
    }

    private String customerRanking(InvoiceAggregates aggregates) {
        // List.sort is stable, so equal totals keep first-occurrence order
        List<Map.Entry<String, BigDecimal>> ranked = new ArrayList<>(aggregates.getAmountByCustomer().entrySet());
        ranked.sort(Map.Entry.<String, BigDecimal>comparingByValue(Comparator.reverseOrder()));

        StringBuilder result = new StringBuilder()
                .append("Customer Analysis:\n")
                .append("- Total customers: ").append(aggregates.getUniqueCustomers().size()).append("\n")
                .append("- Top customers by revenue:\n");
        for (Map.Entry<String, BigDecimal> entry : ranked.subList(0, Math.min(TOP_CUSTOMER_LIMIT, ranked.size()))) {
            result.append("  • ").append(entry.getKey()).append(": ").append(currency(entry.getValue())).append("\n");
        }
        return result.toString();
    }

    private String paymentStatusSummary(InvoiceAggregates aggregates) {
        BigDecimal settled = BigDecimal.valueOf((long) aggregates.getPaidCount() + aggregates.getPartialCount());
        BigDecimal rate = settled.multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(aggregates.getTotal()), MathContext.DECIMAL64);

        return "Payment Status Analysis:\n"
                + "- Fully paid: " + aggregates.getPaidCount() + " invoices\n"
                + "- Partially paid: " + aggregates.getPartialCount() + " invoices\n"
                + "- Payment rate: " + oneDecimal(rate) + "%\n"
                + "- Total collected: " + currency(aggregates.getSumAmount());
    }

    private String countSummary(InvoiceAggregates aggregates) {
        // never zero: analyze() rejects empty record sets and every record names a customer, even a blank one
        int customers = aggregates.getUniqueCustomers().size();
        BigDecimal perCustomer = BigDecimal.valueOf(aggregates.getTotal())
                .divide(BigDecimal.valueOf(customers), MathContext.DECIMAL64);

        return "Invoice Count Analysis:\n"
                + "- Total invoices: " + aggregates.getTotal() + "\n"
                + "- Unique customers: " + customers + "\n"
                + "- Fully paid: " + aggregates.getPaidCount() + "\n"
                + "- Partially paid: " + aggregates.getPartialCount() + "\n"
                + "- Average per customer: " + oneDecimal(perCustomer) + " invoices";
    }

    private String overview(InvoiceAggregates aggregates) {
        return "Invoice Overview:\n"
                + "- Total invoices: " + aggregates.getTotal() + "\n"
                + "- Total revenue: " + currency(aggregates.getSumAmount()) + "\n"
                + "- Customers: " + aggregates.getUniqueCustomers().size() + "\n"
                + "- Paid: " + aggregates.getPaidCount() + ", Partial: " + aggregates.getPartialCount() + "\n"
                + "- Average invoice: " + currency(averageAmount(aggregates));
    }

    private BigDecimal averageAmount(InvoiceAggregates aggregates) {
        return aggregates.getSumAmount().divide(BigDecimal.valueOf(aggregates.getTotal()), MathContext.DECIMAL64);
    }

    private DatasetNotFoundException noRecords(DatasetOrigin origin) {
        DatasetNotFoundException.Reason reason = origin == DatasetOrigin.PERSISTED
                ? DatasetNotFoundException.Reason.NO_PERSISTED_DATASET
                : DatasetNotFoundException.Reason.UNUSABLE_SUPPLIED_DATASET;
        return new DatasetNotFoundException(reason, "No invoice records to analyze");
    }

    /**
     * Formats as US currency with thousands separators, e.g. {@code $1,234.50}.
     * DecimalFormat is not thread-safe, so a new instance is created per call.
     */
    static String currency(BigDecimal amount) {
        DecimalFormat format = new DecimalFormat("$#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(RoundingMode.HALF_EVEN);
        return format.format(amount);
    }

    static String oneDecimal(BigDecimal value) {
        DecimalFormat format = new DecimalFormat("0.0", DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(RoundingMode.HALF_EVEN);
        return format.format(value);
    }
}
