package com.spa.aggregator.crawl.service;

import com.spa.aggregator.crawl.model.CrawlRun;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import com.spa.aggregator.crawl.persistence.CrawlRunJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Persisted state machine for crawl runs. Status is always read from the database, so a pause or cancel issued
 * by the control surface is seen by workers on their next poll.
 */
@Service
public class CrawlRunRegistry {
    private static final Logger log = LoggerFactory.getLogger(CrawlRunRegistry.class);
    private static final int MAX_TRANSITION_ATTEMPTS = 3;

    private final CrawlRunJdbcRepository repository;

    public CrawlRunRegistry(CrawlRunJdbcRepository repository) {
        this.repository = repository;
    }

    public CrawlRun create(String name) {
        return create(name, null);
    }

    public CrawlRun create(String name, String paramsJson) {
        long runId = repository.insertRun(name, paramsJson, Instant.now());
        log.info("Created crawl run {} ({})", runId, name);
        return get(runId);
    }

    public CrawlRun get(long runId) {
        CrawlRun run = repository.findById(runId);
        if (run == null) {
            throw new CrawlRunNotFoundException(runId);
        }
        return run;
    }

    public CrawlRunStatus status(long runId) {
        CrawlRunStatus status = repository.findStatus(runId);
        if (status == null) {
            throw new CrawlRunNotFoundException(runId);
        }
        return status;
    }

    public boolean isRunning(long runId) {
        return status(runId) == CrawlRunStatus.RUNNING;
    }

    public CrawlRun pause(long runId) {
        return transition(runId, CrawlRunStatus.PAUSED, null);
    }

    public CrawlRun resume(long runId) {
        return transition(runId, CrawlRunStatus.RUNNING, null);
    }

    public CrawlRun cancel(long runId) {
        return transition(runId, CrawlRunStatus.CANCELLED, null);
    }

    public CrawlRun complete(long runId) {
        return transition(runId, CrawlRunStatus.COMPLETED, null);
    }

    public CrawlRun fail(long runId, String lastError) {
        return transition(runId, CrawlRunStatus.FAILED, lastError);
    }

    /**
     * @throws IllegalRunTransitionException when the run's current status does not allow {@code target}
     * @throws CrawlRunNotFoundException     when the run does not exist
     */
    public CrawlRun transition(long runId, CrawlRunStatus target, String lastError) {
        CrawlRunStatus current = status(runId);
        for (int attempt = 0; attempt < MAX_TRANSITION_ATTEMPTS; attempt++) {
            if (!current.canTransitionTo(target)) {
                throw new IllegalRunTransitionException(runId, current, target);
            }
            if (repository.transition(runId, current, target, lastError, Instant.now())) {
                log.info("Crawl run {} {} -> {}", runId, current.dbValue(), target.dbValue());
                return get(runId);
            }
            // Another writer changed the status between our read and the update.
            current = status(runId);
        }
        throw new IllegalRunTransitionException(runId, current, target);
    }

    /**
     * Like {@link #transition} but returns false instead of throwing when the run already left the states that allow
     * {@code target}; used by workers finishing a run that may have been cancelled meanwhile.
     */
    public boolean tryTransition(long runId, CrawlRunStatus target, String lastError) {
        try {
            transition(runId, target, lastError);
            return true;
        } catch (IllegalRunTransitionException e) {
            log.info("Crawl run {} not moved to {}: {}", runId, target.dbValue(), e.getMessage());
            return false;
        }
    }

    public void setTotal(long runId, long total) {
        repository.setTotal(runId, total, Instant.now());
    }

    public void incrementCompleted(long runId) {
        repository.incrementCompleted(runId, 1, Instant.now());
    }

    public void recordError(long runId, String message) {
        repository.incrementErrors(runId, message, Instant.now());
    }

    public void updateCheckpoint(long runId, long checkpointOffset) {
        repository.updateCheckpoint(runId, checkpointOffset, Instant.now());
    }

    public List<CrawlRun> recent(int limit) {
        return repository.findRecent(Math.max(1, Math.min(limit, 200)));
    }

    public CrawlRun latest(String name) {
        return repository.findLatestByName(name);
    }

    public List<CrawlRun> active(String name) {
        return repository.findActiveByName(name);
    }

    public List<CrawlRun> running() {
        return repository.findByStatus(CrawlRunStatus.RUNNING);
    }
}
