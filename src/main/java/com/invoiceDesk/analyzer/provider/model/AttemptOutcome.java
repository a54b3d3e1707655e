package com.invoiceDesk.analyzer.provider.model;

/**
 * Outcome of a single provider call.
 */
public enum AttemptOutcome {
    SUCCESS,
    /** Worth retrying against the same provider (network error, 5xx, rate limit). */
    TRANSIENT_FAILURE,
    /** Retrying the same provider cannot help (rejected credential, bad request, empty completion). */
    TERMINAL_FAILURE
}
