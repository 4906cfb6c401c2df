package com.spa.aggregator.crawl.pager;

import java.util.List;

public record CatalogPage<T>(long totalHits, List<T> items) {
    public CatalogPage {
        totalHits = Math.max(0, totalHits);
        items = items == null ? List.of() : List.copyOf(items);
    }
}
