package com.spa.aggregator.crawl.model;

import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a crawl run. {@code running -> completed|failed|paused|cancelled}, {@code paused -> running|cancelled}.
 * Terminal states accept no transition.
 */
public enum CrawlRunStatus {
    RUNNING,
    PAUSED,
    CANCELLED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == CANCELLED || this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(CrawlRunStatus target) {
        if (target == null) {
            return false;
        }
        return allowedTargets().contains(target);
    }

    public Set<CrawlRunStatus> allowedTargets() {
        return switch (this) {
            case RUNNING -> Set.of(COMPLETED, FAILED, PAUSED, CANCELLED);
            case PAUSED -> Set.of(RUNNING, CANCELLED);
            default -> Set.of();
        };
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CrawlRunStatus fromDb(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing crawl run status");
        }
        return CrawlRunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
