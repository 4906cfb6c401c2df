package com.spa.aggregator.crawl.http;

import com.spa.aggregator.config.AggregatorProperties;
import com.spa.aggregator.crawl.model.CatalogFetchException;
import com.spa.aggregator.crawl.model.FetchErrorKind;
import com.spa.aggregator.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Re-runs a fetch that failed with a retryable {@link FetchErrorKind}, waiting a fixed backoff between attempts
 * (longer when rate limited). Non-retryable failures and the last failure are rethrown.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final long transientBackoffMs;
    private final long rateLimitedBackoffMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long transientBackoffMs, long rateLimitedBackoffMs, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.transientBackoffMs = Math.max(0, transientBackoffMs);
        this.rateLimitedBackoffMs = Math.max(0, rateLimitedBackoffMs);
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public static RetryPolicy from(AggregatorProperties.Retry retry, Sleeper sleeper) {
        return new RetryPolicy(
            retry.getMaxAttempts(),
            retry.getTransientBackoffMs(),
            retry.getRateLimitedBackoffMs(),
            sleeper
        );
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0, 0, Sleeper.NONE);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (CatalogFetchException e) {
                if (!e.kind().isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                long backoff = e.kind() == FetchErrorKind.RATE_LIMITED ? rateLimitedBackoffMs : transientBackoffMs;
                log.warn(
                    "{} failed with {} (attempt {}/{}), retrying in {} ms",
                    operation,
                    e.errorKey(),
                    attempt,
                    maxAttempts,
                    backoff
                );
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new CatalogFetchException(FetchErrorKind.PERMANENT, 0, operation + " interrupted", interrupted);
                }
            }
        }
    }
}
