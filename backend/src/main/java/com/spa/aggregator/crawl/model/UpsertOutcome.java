package com.spa.aggregator.crawl.model;

public record UpsertOutcome(String id, boolean inserted) {
}
