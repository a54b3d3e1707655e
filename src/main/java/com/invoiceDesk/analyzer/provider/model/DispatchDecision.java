package com.invoiceDesk.analyzer.provider.model;

/**
 * What the dispatcher does once a provider has finished its attempts.
 */
public enum DispatchDecision {
    COMPLETE,
    NEXT_PROVIDER
}
