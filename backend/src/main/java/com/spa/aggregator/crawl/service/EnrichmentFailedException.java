package com.spa.aggregator.crawl.service;

import com.spa.aggregator.crawl.model.SourceAttempt;

import java.util.List;
import java.util.stream.Collectors;

/**
 * No detail source yielded data for a product.
 */
public class EnrichmentFailedException extends RuntimeException {
    public static final String ERROR_KEY = "no_source_data";

    private final List<SourceAttempt> attempts;

    public EnrichmentFailedException(String isin, List<SourceAttempt> attempts) {
        super("No detail source yielded data for " + isin + ": " + describe(attempts));
        this.attempts = List.copyOf(attempts);
    }

    public List<SourceAttempt> attempts() {
        return attempts;
    }

    private static String describe(List<SourceAttempt> attempts) {
        if (attempts.isEmpty()) {
            return "no detail sources configured";
        }
        return attempts.stream().map(SourceAttempt::describe).collect(Collectors.joining("; "));
    }
}
