package com.invoiceDesk.analyzer.provider.prompt;

import com.invoiceDesk.analyzer.dataset.model.DatasetOrigin;
import com.invoiceDesk.analyzer.dataset.model.InvoiceRecord;
import com.invoiceDesk.analyzer.dataset.model.RecordSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisPromptTest {

    private static RecordSet invoices(int count) {
        List<InvoiceRecord> records = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            records.add(InvoiceRecord.builder()
                    .id("INV-" + i)
                    .customer("Customer " + i)
                    .amount(i + "0.00")
                    .paidAt("2024-03-0" + (i % 9 + 1))
                    .status("Paid")
                    .build());
        }
        return new RecordSet(records, DatasetOrigin.PERSISTED);
    }

    @Test
    void summarize_shouldListAllRecordsUpToTheLimit() {
        String summary = AnalysisPrompt.summarize(invoices(10));

        assertThat(summary).startsWith("Invoice Data Summary:\nTotal Invoices: 10\n\n");
        assertThat(summary).contains("1. Invoice INV-1: Customer 1, $10.00, Paid, Paid: 2024-03-02\n");
        assertThat(summary).contains("10. Invoice INV-10: Customer 10, $100.00, Paid, Paid: 2024-03-02\n");
        assertThat(summary).doesNotContain("more invoices");
    }

    @Test
    void summarize_shouldReportRecordsBeyondTheLimitAsACount() {
        String summary = AnalysisPrompt.summarize(invoices(11));

        assertThat(summary).contains("Total Invoices: 11\n");
        assertThat(summary).contains("10. Invoice INV-10:");
        assertThat(summary).doesNotContain("INV-11").doesNotContain("Customer 11");
        assertThat(summary).endsWith("... and 1 more invoices\n");
    }

    @Test
    void summarize_shouldCountEveryOmittedRecord() {
        String summary = AnalysisPrompt.summarize(invoices(25));

        assertThat(summary.lines().filter(line -> line.contains(". Invoice INV-")).count())
                .isEqualTo(AnalysisPrompt.MAX_RECORDS_IN_PROMPT);
        assertThat(summary).endsWith("... and 15 more invoices\n");
    }

    @Test
    void build_shouldCarrySummaryAndQuery() {
        String prompt = AnalysisPrompt.build("Which customer paid the most?", invoices(2));

        assertThat(prompt).startsWith("Invoice Data Summary:\n");
        assertThat(prompt).contains("User Query: Which customer paid the most?");
        assertThat(prompt).contains("Please analyze the invoice data");
    }
}
