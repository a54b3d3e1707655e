package com.invoiceDesk.analyzer.provider.prompt;

import com.invoiceDesk.analyzer.dataset.model.InvoiceRecord;
import com.invoiceDesk.analyzer.dataset.model.RecordSet;

import java.util.List;

/**
 * Prompts sent to the external text-generation providers.
 *
 * Only the first {@value #MAX_RECORDS_IN_PROMPT} records are included verbatim to keep
 * the prompt size bounded; the remainder is reported as a count.
 */
public class AnalysisPrompt {

    public static final int MAX_RECORDS_IN_PROMPT = 10;

    public static final String SYSTEM_PROMPT =
            "You are a financial analyst assistant. Analyze invoice data and provide concise, actionable insights.";

    private AnalysisPrompt() {
    }

    /**
     * Builds the user prompt for a query.
     *
     * @param query User query
     * @param records Records of the request
     * @return Prompt text
     */
    public static String build(String query, RecordSet records) {
        return """
            %s
            User Query: %s

            Please analyze the invoice data and provide a concise response to the user's query.
            Focus on key insights, patterns, and specific numbers where relevant.
            """.formatted(summarize(records), query);
    }

    /**
     * Bounded textual summary of the records.
     */
    public static String summarize(RecordSet records) {
        StringBuilder summary = new StringBuilder()
                .append("Invoice Data Summary:\n")
                .append("Total Invoices: ").append(records.size()).append("\n\n");

        List<InvoiceRecord> head = records.head(MAX_RECORDS_IN_PROMPT);
        for (int i = 0; i < head.size(); i++) {
            InvoiceRecord invoice = head.get(i);
            summary.append(i + 1).append(". Invoice ").append(invoice.getId()).append(": ")
                    .append(invoice.getCustomer()).append(", $").append(invoice.getAmount()).append(", ")
                    .append(invoice.getStatus()).append(", Paid: ").append(invoice.getPaidAt()).append("\n");
        }

        if (records.size() > MAX_RECORDS_IN_PROMPT) {
            summary.append("... and ").append(records.size() - MAX_RECORDS_IN_PROMPT).append(" more invoices\n");
        }
        return summary.toString();
    }
}
