package com.spa.aggregator.crawl.model;

import java.util.List;

public record ProductPageResponse(List<ProductRecord> items, long total, int limit, int offset) {
}
