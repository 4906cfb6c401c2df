package com.spa.aggregator.crawl.pager;

import com.spa.aggregator.crawl.model.CatalogFetchException;

/**
 * A paginated search endpoint that refuses to serve results at or beyond its window ceiling.
 * Failures are reported as {@link CatalogFetchException}.
 */
public interface CatalogProvider<T> {

    CatalogPage<T> fetchPage(CatalogQuery query, int offset, int pageSize);

    default long probeCount(CatalogQuery query) {
        return fetchPage(query, 0, 1).totalHits();
    }
}
