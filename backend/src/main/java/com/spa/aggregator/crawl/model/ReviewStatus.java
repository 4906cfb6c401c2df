package com.spa.aggregator.crawl.model;

import java.util.Locale;

public enum ReviewStatus {
    PENDING,
    REVIEWED,
    TO_BE_SIGNED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReviewStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("review status is required");
        }
        return ReviewStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
