package com.spa.aggregator.crawl.model;

public record ItemError(String itemKey, String errorKey, String message) {
}
