package com.spa.aggregator.crawl.model;

import java.time.Instant;

public record CrawlRun(
    long id,
    String name,
    CrawlRunStatus status,
    Long total,
    long completed,
    long errorsCount,
    String lastError,
    long checkpointOffset,
    String paramsJson,
    Instant startedAt,
    Instant updatedAt,
    Instant endedAt
) {
    public static final String CATALOG_API = "catalog_api";
    public static final String AUTO_ENRICHMENT = "auto_enrichment";
    public static final String ENRICHMENT_CYCLE = "enrichment_cycle";

    public boolean isActive() {
        return status == CrawlRunStatus.RUNNING || status == CrawlRunStatus.PAUSED;
    }
}
