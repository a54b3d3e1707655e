package com.invoiceDesk.analyzer.dataset.service;

import com.invoiceDesk.analyzer.dataset.model.DatasetOrigin;
import com.invoiceDesk.analyzer.dataset.model.InvoiceRecord;
import com.invoiceDesk.analyzer.dataset.service.InvoiceDatasetRepository.PersistedDataset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class InvoiceDatasetRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldReturnEmptyDatasetWhenFileIsMissing() {
        InvoiceDatasetRepository repository =
                new InvoiceDatasetRepository(new InvoiceCsvParser(), tempDir.resolve("invoices.csv").toString());

        PersistedDataset dataset = repository.load();

        assertThat(dataset.rawText()).isEmpty();
        assertThat(dataset.records().isEmpty()).isTrue();
        assertThat(dataset.records().getOrigin()).isEqualTo(DatasetOrigin.PERSISTED);
    }

    @Test
    void load_shouldReturnRawTextAndRecords() throws Exception {
        String content = "invoice_id,customer,amount,paid_at,status\nINV-7,Initech,300,2024-02-01,Paid\n";
        Path file = Files.writeString(tempDir.resolve("invoices.csv"), content, StandardCharsets.UTF_8);
        InvoiceDatasetRepository repository = new InvoiceDatasetRepository(new InvoiceCsvParser(), file.toString());

        PersistedDataset dataset = repository.load();

        assertThat(dataset.rawText()).isEqualTo(content);
        assertThat(dataset.records().size()).isEqualTo(1);
        assertThat(dataset.records().getRecords().get(0).getCustomer()).isEqualTo("Initech");
    }

    @Test
    void load_shouldReadQuotedCustomerAndSkipBrokenRow() throws Exception {
        String content = "invoice_id,customer,amount,paid_at,status\n"
                + "INV-1,Acme,100,2024-01-01,Paid\n"
                + "INV-2,\"Globex, Inc\",50,2024-01-02,Paid\n"
                + "INV-3,Initech,Corp,75,2024-01-03,Paid\n";
        Path file = Files.writeString(tempDir.resolve("invoices.csv"), content, StandardCharsets.UTF_8);
        InvoiceDatasetRepository repository = new InvoiceDatasetRepository(new InvoiceCsvParser(), file.toString());

        PersistedDataset dataset = repository.load();

        assertThat(dataset.rawText()).isEqualTo(content);
        assertThat(dataset.records().getRecords())
                .extracting(InvoiceRecord::getCustomer)
                .containsExactly("Acme", "Globex, Inc");
    }
}
