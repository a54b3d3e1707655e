package com.invoiceDesk.analyzer.dataset.exception;

/**
 * Exception thrown when an inline dataset supplied by the caller cannot be parsed.
 */
public class InvalidDatasetException extends RuntimeException {
    
    public InvalidDatasetException(String message) {
        super(message);
    }
}
