package com.spa.aggregator.crawl.pager;

/**
 * One query segment: a free-text prefix plus the crawl's filters. The root query has an empty prefix.
 */
public record CatalogQuery(String prefix, CatalogFilters filters) {
    public CatalogQuery {
        prefix = prefix == null ? "" : prefix;
        filters = filters == null ? CatalogFilters.none() : filters;
    }

    public static CatalogQuery root(CatalogFilters filters) {
        return new CatalogQuery("", filters);
    }

    public CatalogQuery child(String symbol) {
        return new CatalogQuery(prefix + symbol, filters);
    }

    public boolean isRoot() {
        return prefix.isEmpty();
    }

    /**
     * Search text sent to the provider. The root of a symbol-restricted crawl searches for any of the symbols.
     */
    public String searchText() {
        if (isRoot() && !filters.symbols().isEmpty()) {
            return String.join(" OR ", filters.symbols());
        }
        return prefix;
    }

    public String label() {
        return isRoot() ? "<root>" : prefix;
    }
}
