package com.spa.aggregator.crawl.pager;

import java.util.List;
import java.util.Objects;

/**
 * Caller-supplied restrictions of a catalog crawl. {@code symbols}, when present, replace the alphabet as root segments.
 */
public record CatalogFilters(List<String> productTypes, List<String> symbols, List<String> currencies) {
    public CatalogFilters {
        productTypes = clean(productTypes);
        symbols = clean(symbols);
        currencies = clean(currencies);
    }

    public static CatalogFilters none() {
        return new CatalogFilters(List.of(), List.of(), List.of());
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .distinct()
            .toList();
    }
}
