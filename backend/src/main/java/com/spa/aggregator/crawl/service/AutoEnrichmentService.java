package com.spa.aggregator.crawl.service;

import com.spa.aggregator.config.AggregatorProperties;
import com.spa.aggregator.crawl.model.AutoEnrichmentStatus;
import com.spa.aggregator.crawl.model.BatchResult;
import com.spa.aggregator.crawl.model.CrawlRun;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import com.spa.aggregator.crawl.model.EnrichmentCheckpoint;
import com.spa.aggregator.crawl.util.Sleeper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs enrichment batches back to back under one {@code auto_enrichment} run. The loop follows the persisted run
 * status: it waits while the run is paused and exits once the run is cancelled or otherwise finished.
 */
@Service
public class AutoEnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(AutoEnrichmentService.class);
    private static final long PAUSE_POLL_MS = 1000;

    private final EnrichmentService enrichmentService;
    private final CrawlRunRegistry runRegistry;
    private final AggregatorProperties properties;
    private final ExecutorService autoEnrichExecutor;
    private final Sleeper sleeper;
    private final Object lifecycleLock = new Object();
    private final AtomicLong cyclesCompleted = new AtomicLong();
    private final AtomicReference<BatchResult> lastResult = new AtomicReference<>();

    private Future<?> loop;

    public AutoEnrichmentService(
        EnrichmentService enrichmentService,
        CrawlRunRegistry runRegistry,
        AggregatorProperties properties,
        @Qualifier("autoEnrichExecutor") ExecutorService autoEnrichExecutor,
        Sleeper sleeper
    ) {
        this.enrichmentService = enrichmentService;
        this.runRegistry = runRegistry;
        this.properties = properties;
        this.autoEnrichExecutor = autoEnrichExecutor;
        this.sleeper = sleeper;
    }

    /**
     * Starts the loop. A paused {@code auto_enrichment} run left by an earlier process is resumed instead of
     * creating a new one.
     *
     * @throws ActiveCrawlRunException when the loop is already active in this process
     */
    public AutoEnrichmentStatus start(Integer batchSize) {
        int size = batchSize == null ? properties.getEnrichment().getDefaultBatchSize() : Math.max(1, batchSize);
        synchronized (lifecycleLock) {
            if (isLoopActive()) {
                throw new ActiveCrawlRunException("Auto-enrichment is already running");
            }
            CrawlRun run = adoptOrCreateRun();
            long runId = run.id();
            log.info("Starting auto-enrichment loop for run {} with batch size {}", runId, size);
            loop = autoEnrichExecutor.submit(() -> runLoop(runId, size));
        }
        return status();
    }

    /**
     * Cancels the current run; the loop exits after the batch in progress.
     */
    public AutoEnrichmentStatus stop() {
        for (CrawlRun run : runRegistry.active(CrawlRun.AUTO_ENRICHMENT)) {
            runRegistry.tryTransition(run.id(), CrawlRunStatus.CANCELLED, null);
        }
        return status();
    }

    public AutoEnrichmentStatus status() {
        return new AutoEnrichmentStatus(
            isLoopActive(),
            runRegistry.latest(CrawlRun.AUTO_ENRICHMENT),
            enrichmentService.checkpoint(),
            cyclesCompleted.get(),
            lastResult.get()
        );
    }

    /**
     * @throws ActiveCrawlRunException while the loop is active
     */
    public EnrichmentCheckpoint reset() {
        synchronized (lifecycleLock) {
            if (isLoopActive()) {
                throw new ActiveCrawlRunException("Stop auto-enrichment before resetting its checkpoint");
            }
            return enrichmentService.resetCheckpoint();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        synchronized (lifecycleLock) {
            if (loop != null) {
                loop.cancel(true);
                loop = null;
            }
        }
    }

    private boolean isLoopActive() {
        synchronized (lifecycleLock) {
            return loop != null && !loop.isDone();
        }
    }

    private CrawlRun adoptOrCreateRun() {
        List<CrawlRun> active = runRegistry.active(CrawlRun.AUTO_ENRICHMENT);
        for (CrawlRun run : active) {
            if (run.status() == CrawlRunStatus.RUNNING) {
                return run;
            }
            if (run.status() == CrawlRunStatus.PAUSED) {
                return runRegistry.resume(run.id());
            }
        }
        return runRegistry.create(CrawlRun.AUTO_ENRICHMENT);
    }

    void runLoop(long runId, int batchSize) {
        long cycleDelayMs = properties.getEnrichment().getCycleDelaySeconds() * 1000L;
        try {
            while (!Thread.currentThread().isInterrupted()) {
                CrawlRunStatus status = runRegistry.status(runId);
                if (status.isTerminal()) {
                    log.info("Auto-enrichment run {} is {}, leaving loop", runId, status.dbValue());
                    return;
                }
                if (status == CrawlRunStatus.PAUSED) {
                    sleeper.sleep(PAUSE_POLL_MS);
                    continue;
                }
                long delay = cycleDelayMs;
                try {
                    BatchResult result = enrichmentService.runCycle(batchSize, runId);
                    lastResult.set(result);
                    cyclesCompleted.incrementAndGet();
                    if (result.candidates() == 0) {
                        delay = cycleDelayMs * 2;
                    }
                } catch (ActiveCrawlRunException e) {
                    log.info("Auto-enrichment run {} waiting: {}", runId, e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Auto-enrichment cycle failed for run {}", runId, e);
                    runRegistry.recordError(runId, "cycle_failed: " + e.getMessage());
                }
                waitWhileRunning(runId, delay);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Auto-enrichment loop for run {} interrupted", runId);
        }
    }

    private void waitWhileRunning(long runId, long delayMs) throws InterruptedException {
        long remaining = delayMs;
        while (remaining > 0 && runRegistry.status(runId) == CrawlRunStatus.RUNNING) {
            long slice = Math.min(PAUSE_POLL_MS, remaining);
            sleeper.sleep(slice);
            remaining -= slice;
        }
    }
}
