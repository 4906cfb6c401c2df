package com.spa.aggregator.crawl.model;

import java.util.List;

/**
 * Outcome of one batch cycle. Every attempted item is counted in exactly one of {@code succeeded} and {@code failed};
 * {@code errors} is a bounded sample of the failures.
 */
public record BatchResult(
    int candidates,
    int processed,
    int succeeded,
    int failed,
    long offsetBefore,
    long offsetAfter,
    List<ItemError> errors,
    String stopReason
) {
    public static final String STOP_EXHAUSTED = "candidates_exhausted";
    public static final String STOP_BATCH_DONE = "batch_done";
    public static final String STOP_PAUSED = "paused";
    public static final String STOP_CANCELLED = "cancelled";
    public static final String STOP_FATAL = "fatal_error";

    public BatchResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
