package com.spa.aggregator.crawl.batch;

import com.spa.aggregator.crawl.model.CatalogFetchException;

/**
 * Processes one candidate. Returning normally counts as success; any exception counts as a failure of that item only,
 * except run-level failures (see {@link ResumableBatchDriver}) which stop dispatch.
 */
public interface BatchItemHandler<C> {

    String key(C item);

    void process(C item);

    /**
     * Short machine-readable key for a failure, used in error samples.
     */
    default String errorKey(RuntimeException failure) {
        if (failure instanceof CatalogFetchException fetch) {
            return fetch.errorKey();
        }
        return failure.getClass().getSimpleName();
    }
}
