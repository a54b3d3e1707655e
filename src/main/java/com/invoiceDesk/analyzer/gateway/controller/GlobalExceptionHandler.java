package com.invoiceDesk.analyzer.gateway.controller;

import com.invoiceDesk.analyzer.dataset.exception.DatasetNotFoundException;
import com.invoiceDesk.analyzer.dataset.exception.InvalidDatasetException;
import com.invoiceDesk.analyzer.heuristic.exception.HeuristicUnavailableException;
import com.invoiceDesk.analyzer.provider.exception.ProviderCallException;
import com.invoiceDesk.analyzer.provider.exception.ProviderConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler - maps failures to {code, message} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");
        
        log.warn("Validation error: {}", message);
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request body is not valid JSON");
    }
    
    @ExceptionHandler(InvalidDatasetException.class)
    public ResponseEntity<ErrorResponse> handleInvalidDataset(InvalidDatasetException ex) {
        log.warn("Invalid dataset: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
    }
    
    @ExceptionHandler(DatasetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleDatasetNotFound(DatasetNotFoundException ex) {
        log.warn("Dataset not found - reason: {}", ex.getReason());
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }
    
    @ExceptionHandler(ProviderConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleProviderConfiguration(ProviderConfigurationException ex) {
        log.error("Provider configuration error: {}", ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "PROVIDER_CONFIGURATION_ERROR", ex.getMessage());
    }
    
    @ExceptionHandler(ProviderCallException.class)
    public ResponseEntity<ErrorResponse> handleProviderCall(ProviderCallException ex) {
        log.error("Provider call failed after {} attempts: {}", ex.getAttempts().size(), ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "PROVIDER_CALL_ERROR", "Analysis failed: " + ex.getMessage());
    }
    
    @ExceptionHandler(HeuristicUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleHeuristicUnavailable(HeuristicUnavailableException ex) {
        log.error("Heuristic analyzer unavailable: {}", ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "HEURISTIC_UNAVAILABLE", "Free analysis failed: " + ex.getMessage());
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }
    
    private ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }
    
    public record ErrorResponse(String code, String message) {}
}
