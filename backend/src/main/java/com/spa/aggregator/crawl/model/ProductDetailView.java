package com.spa.aggregator.crawl.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ProductDetailView(ProductRecord record, JsonNode normalized) {
}
