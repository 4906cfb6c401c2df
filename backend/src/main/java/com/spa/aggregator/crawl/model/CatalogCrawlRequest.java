package com.spa.aggregator.crawl.model;

import java.util.List;

/**
 * Body of a catalog crawl start request. {@code maxItems} of 0 or null means no limit.
 */
public record CatalogCrawlRequest(
    List<String> productTypes,
    List<String> symbols,
    List<String> currencies,
    Long maxItems
) {
    public static CatalogCrawlRequest unrestricted() {
        return new CatalogCrawlRequest(List.of(), List.of(), List.of(), null);
    }

    public long maxItemsOrZero() {
        return maxItems == null ? 0 : Math.max(0, maxItems);
    }
}
