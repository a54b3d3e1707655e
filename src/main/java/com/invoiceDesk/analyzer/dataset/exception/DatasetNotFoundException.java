package com.invoiceDesk.analyzer.dataset.exception;

import lombok.Getter;

/**
 * Exception thrown when a request has no records to analyze.
 */
@Getter
public class DatasetNotFoundException extends RuntimeException {
    
    public enum Reason {
        /** No dataset was supplied and none is persisted. */
        NO_PERSISTED_DATASET,
        /** The caller supplied a dataset that contained no usable rows. */
        UNUSABLE_SUPPLIED_DATASET
    }
    
    private final Reason reason;
    
    public DatasetNotFoundException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
