package com.spa.aggregator.crawl.model;

/**
 * How a failed fetch should be handled by callers.
 */
public enum FetchErrorKind {
    /** Timeouts, disconnects, 408 and 5xx. Retried with the fixed backoff. */
    TRANSIENT,
    /** 429. Retried with the longer backoff. */
    RATE_LIMITED,
    /** Missing, rejected or expired credentials. Fails the whole run. */
    AUTH_INVALID,
    NOT_FOUND,
    PERMANENT;

    public boolean isRetryable() {
        return this == TRANSIENT || this == RATE_LIMITED;
    }

    public boolean isFatalForRun() {
        return this == AUTH_INVALID;
    }
}
