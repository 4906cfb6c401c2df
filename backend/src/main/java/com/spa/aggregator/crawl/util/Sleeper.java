package com.spa.aggregator.crawl.util;

/**
 * Blocking pause used for rate limiting and backoff; replaced with a no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = millis -> {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    Sleeper NONE = millis -> {
    };

    void sleep(long millis) throws InterruptedException;
}
