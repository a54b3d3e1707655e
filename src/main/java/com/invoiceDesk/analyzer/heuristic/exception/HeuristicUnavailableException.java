package com.invoiceDesk.analyzer.heuristic.exception;

/**
 * Exception thrown when the local heuristic analyzer is disabled in this runtime.
 */
public class HeuristicUnavailableException extends RuntimeException {
    
    public HeuristicUnavailableException(String message) {
        super(message);
    }
}
