package com.spa.aggregator.crawl.pager;

import com.spa.aggregator.crawl.model.FetchErrorKind;

public record SegmentFailure(String segment, FetchErrorKind kind, String message) {
}
