package com.spa.aggregator.crawl.model;

import java.time.Instant;

/**
 * Row of the {@code products} table without the normalized document.
 */
public record ProductRecord(
    String id,
    String contentHash,
    String sourceKind,
    String isin,
    String valorNumber,
    String issuerName,
    String productType,
    String currency,
    String maturityDate,
    Double couponRatePctPa,
    boolean barrierPresent,
    String reviewStatus,
    String sourceFilePath,
    Instant createdAt,
    Instant updatedAt
) {
}
