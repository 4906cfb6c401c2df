package com.spa.aggregator.crawl.pager;

public interface PagerHooks<T> {

    void onItem(T item);

    default void onTotal(long totalHits) {
    }

    /**
     * Called after every page with the traversal position reached so far.
     */
    default void onCheckpoint(long position) {
    }

    /**
     * Polled before every request; returning false ends the traversal at the next page boundary.
     */
    default boolean shouldContinue() {
        return true;
    }
}
