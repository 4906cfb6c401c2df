package com.spa.aggregator.crawl.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Persisted progress of the enrichment batch driver.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnrichmentCheckpoint(
    @JsonProperty("offset") long offset,
    @JsonProperty("total_enriched") long totalEnriched,
    @JsonProperty("total_failed") long totalFailed,
    @JsonProperty("last_run_timestamp") Instant lastRunTimestamp
) {
    public static EnrichmentCheckpoint initial() {
        return new EnrichmentCheckpoint(0, 0, 0, null);
    }

    public EnrichmentCheckpoint withOffset(long newOffset, Instant at) {
        return new EnrichmentCheckpoint(Math.max(0, newOffset), totalEnriched, totalFailed, at);
    }
}
