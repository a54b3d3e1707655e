package com.invoiceDesk.analyzer.dataset.model;

import lombok.Getter;

import java.util.List;

/**
 * Ordered, immutable collection of invoice records for a single request.
 * 
 * Insertion order is preserved because ranking ties are resolved by first occurrence.
 */
@Getter
public final class RecordSet {
    
    private final List<InvoiceRecord> records;
    private final DatasetOrigin origin;
    
    public RecordSet(List<InvoiceRecord> records, DatasetOrigin origin) {
        this.records = List.copyOf(records);
        this.origin = origin;
    }
    
    public static RecordSet empty(DatasetOrigin origin) {
        return new RecordSet(List.of(), origin);
    }
    
    public int size() {
        return records.size();
    }
    
    public boolean isEmpty() {
        return records.isEmpty();
    }
    
    /**
     * Returns at most the first {@code limit} records, in order.
     */
    public List<InvoiceRecord> head(int limit) {
        return records.subList(0, Math.min(limit, records.size()));
    }
}
