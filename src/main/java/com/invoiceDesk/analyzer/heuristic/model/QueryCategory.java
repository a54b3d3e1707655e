package com.invoiceDesk.analyzer.heuristic.model;

import java.util.List;
import java.util.Locale;

/**
 * Report categories of the heuristic analyzer, in classification priority order.
 */
public enum QueryCategory {
    
    REVENUE(List.of("revenue", "total", "amount", "sum")),
    CUSTOMERS(List.of("customer", "client", "who")),
    PAYMENT_STATUS(List.of("status", "paid", "payment")),
    COUNT(List.of("count", "how many", "number")),
    OVERVIEW(List.of());
    
    private final List<String> keywords;
    
    QueryCategory(List<String> keywords) {
        this.keywords = keywords;
    }
    
    /**
     * Picks the first category, in declaration order, whose keywords occur anywhere in the query.
     * Matching is a case-insensitive substring test; a query matching nothing is an overview.
     * 
     * @param query Free-text query
     * @return Matching category, never null
     */
    public static QueryCategory classify(String query) {
        String normalized = query == null ? "" : query.toLowerCase(Locale.ROOT);
        for (QueryCategory category : values()) {
            for (String keyword : category.keywords) {
                if (normalized.contains(keyword)) {
                    return category;
                }
            }
        }
        return OVERVIEW;
    }
}
