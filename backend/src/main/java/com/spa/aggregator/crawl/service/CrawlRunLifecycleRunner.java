package com.spa.aggregator.crawl.service;

import com.spa.aggregator.config.AggregatorProperties;
import com.spa.aggregator.crawl.model.CrawlRun;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import com.spa.aggregator.crawl.persistence.CrawlRunJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Settles runs left {@code running} by a previous process. Catalog crawls are paused so they can be resumed from
 * their checkpoint; other runs are failed.
 */
@Component
@Order(0)
public class CrawlRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlRunLifecycleRunner.class);
    static final String INTERRUPTED_BY_RESTART = "interrupted_by_restart";

    private final CrawlRunJdbcRepository repository;
    private final CrawlRunRegistry runRegistry;
    private final AggregatorProperties properties;

    public CrawlRunLifecycleRunner(
        CrawlRunJdbcRepository repository,
        CrawlRunRegistry runRegistry,
        AggregatorProperties properties
    ) {
        this.repository = repository;
        this.runRegistry = runRegistry;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping crawl run cleanup because database is unreachable");
            return;
        }

        int staleMinutes = properties.getRuns().getStaleRunMinutes();
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(staleMinutes));
        for (CrawlRun run : runRegistry.running()) {
            Instant lastActivity = run.updatedAt() == null ? run.startedAt() : run.updatedAt();
            if (lastActivity != null && lastActivity.isAfter(cutoff)) {
                continue;
            }
            if (CrawlRun.CATALOG_API.equals(run.name())) {
                if (runRegistry.tryTransition(run.id(), CrawlRunStatus.PAUSED, INTERRUPTED_BY_RESTART)) {
                    log.info("Paused stale catalog crawl {} at position {}", run.id(), run.checkpointOffset());
                }
            } else if (runRegistry.tryTransition(run.id(), CrawlRunStatus.FAILED, INTERRUPTED_BY_RESTART)) {
                log.info("Failed stale {} run {} last active at {}", run.name(), run.id(), lastActivity);
            }
        }
    }
}
