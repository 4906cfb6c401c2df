package com.spa.aggregator.crawl.batch;

import java.util.List;

/**
 * Ordered work list read page by page. The order must be stable between calls for offsets to stay meaningful.
 */
@FunctionalInterface
public interface CandidateSource<C> {

    List<C> fetch(int limit, long offset);
}
