package com.spa.aggregator.product.model;

/**
 * Records that a merge replaced the value of {@code field} from source {@code from} with the value from {@code to}.
 */
public record AuditEntry(String field, String from, String to, String reason) {
    public static final String REASON_HIGHER_CONFIDENCE = "higher_confidence";
}
