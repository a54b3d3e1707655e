package com.invoiceDesk.analyzer.dataset.service;

import com.invoiceDesk.analyzer.dataset.model.DatasetOrigin;
import com.invoiceDesk.analyzer.dataset.model.RecordSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the persisted invoice dataset from disk.
 * 
 * The file is re-read on every call so a refreshed export is picked up without a restart.
 */
@Slf4j
@Repository
public class InvoiceDatasetRepository {
    
    private final InvoiceCsvParser parser;
    private final Path datasetPath;
    
    public InvoiceDatasetRepository(InvoiceCsvParser parser,
                                    @Value("${analyzer.dataset.path:invoices.csv}") String datasetPath) {
        this.parser = parser;
        this.datasetPath = Path.of(datasetPath);
    }
    
    /**
     * Loads the persisted dataset.
     * 
     * @return Raw text and parsed records; both empty if the file does not exist
     */
    public PersistedDataset load() {
        if (!Files.exists(datasetPath)) {
            log.debug("No persisted dataset at {}", datasetPath.toAbsolutePath());
            return new PersistedDataset("", RecordSet.empty(DatasetOrigin.PERSISTED));
        }
        
        try {
            String content = Files.readString(datasetPath, StandardCharsets.UTF_8);
            return new PersistedDataset(content, parser.parsePersisted(content));
        } catch (IOException e) {
            log.error("Failed to read persisted dataset at {}", datasetPath.toAbsolutePath(), e);
            throw new UncheckedIOException("Failed to read dataset file " + datasetPath, e);
        }
    }
    
    /**
     * Raw dataset text (used for fingerprinting) together with its parsed records.
     */
    public record PersistedDataset(String rawText, RecordSet records) {}
}
