package com.invoiceDesk.analyzer.cache.util;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Computes the identity of an analysis request from its literal query and dataset text.
 */
public final class RequestFingerprint {
    
    public static final int PREFIX_LENGTH = 8;
    
    private RequestFingerprint() {
    }
    
    /**
     * Computes a SHA-256 fingerprint over the query and the raw dataset text.
     * The query is length-prefixed so the boundary between the two inputs is unambiguous.
     * 
     * @param query Query text exactly as received
     * @param datasetText Dataset text exactly as received or read from disk
     * @return 64 lowercase hex characters
     */
    public static String of(String query, String datasetText) {
        return Hashing.sha256().newHasher()
                .putInt(query.length())
                .putString(query, StandardCharsets.UTF_8)
                .putString(datasetText, StandardCharsets.UTF_8)
                .hash()
                .toString();
    }
    
    public static String prefix(String fingerprint) {
        return fingerprint.substring(0, Math.min(PREFIX_LENGTH, fingerprint.length()));
    }
}
