package com.spa.aggregator.crawl.model;

/**
 * @param loopActive whether this process is currently driving the loop
 * @param run        the latest {@code auto_enrichment} run, null when none was ever started
 * @param lastResult the last batch finished by this process, null before the first one
 */
public record AutoEnrichmentStatus(
    boolean loopActive,
    CrawlRun run,
    EnrichmentCheckpoint checkpoint,
    long cyclesCompleted,
    BatchResult lastResult
) {
}
