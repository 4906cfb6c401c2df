package com.spa.aggregator.crawl.model;

import java.util.Locale;

/**
 * Which stored products are offered to the enrichment driver.
 */
public enum EnrichmentFilterMode {
    MISSING_ANY,
    MISSING_COUPON,
    MISSING_BARRIER,
    ALL_WITH_ISIN;

    public static EnrichmentFilterMode parse(String value) {
        if (value == null || value.isBlank()) {
            return MISSING_ANY;
        }
        return EnrichmentFilterMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
