package com.spa.aggregator.crawl.pager;

import com.spa.aggregator.config.AggregatorProperties;

/**
 * @param windowCeiling largest offset window the provider serves; offsets at or beyond it are never requested
 * @param maxItems      stop after emitting this many items, 0 for no limit
 */
public record PagerSettings(
    int windowCeiling,
    int pageSize,
    String alphabet,
    int maxDepth,
    long delayMs,
    long maxItems
) {
    public PagerSettings {
        windowCeiling = Math.max(1, windowCeiling);
        pageSize = Math.max(1, Math.min(pageSize, windowCeiling));
        alphabet = alphabet == null || alphabet.isEmpty() ? "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789" : alphabet;
        maxDepth = Math.max(1, maxDepth);
        delayMs = Math.max(0, delayMs);
        maxItems = Math.max(0, maxItems);
    }

    public static PagerSettings from(AggregatorProperties.Catalog catalog, long maxItems) {
        return new PagerSettings(
            catalog.getWindowCeiling(),
            catalog.getPageSize(),
            catalog.getAlphabet(),
            catalog.getMaxDepth(),
            catalog.getRateLimitMs(),
            maxItems
        );
    }
}
