package com.spa.aggregator.crawl.model;

public record EnrichmentCandidate(String id, String isin, String normalizedJson) {
}
