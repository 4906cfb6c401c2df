package com.spa.aggregator.crawl.model;

public record ProductListQuery(
    String sourceKind,
    String productType,
    String currency,
    String reviewStatus,
    String search,
    int limit,
    int offset
) {
    public ProductListQuery {
        limit = Math.max(1, Math.min(limit, 500));
        offset = Math.max(0, offset);
    }
}
