package com.invoiceDesk.analyzer.dataset.model;

/**
 * Where the records of a request came from.
 */
public enum DatasetOrigin {
    /** Supplied by the caller in the request body. */
    INLINE,
    /** Read from the dataset file on disk. */
    PERSISTED
}
