package com.spa.aggregator.crawl.batch;

import com.spa.aggregator.crawl.model.BatchResult;
import com.spa.aggregator.crawl.model.CatalogFetchException;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import com.spa.aggregator.crawl.model.EnrichmentCheckpoint;
import com.spa.aggregator.crawl.model.ItemError;
import com.spa.aggregator.crawl.service.CrawlRunRegistry;
import com.spa.aggregator.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs bounded batches over a {@link CandidateSource}, remembering in an {@link EnrichmentCheckpointStore} how far
 * the previous batch got so the next one continues after it.
 * <p>
 * The checkpoint offset advances by the number of items handed to workers and is saved after every finished item.
 * When a run id is given, the run status is read before every dispatch: {@code paused} or {@code cancelled} stops
 * dispatching, in-flight items still finish. An authentication failure stops the batch and fails the run.
 * An interrupt of the dispatching thread interrupts the workers; items that do not finish are counted as failed.
 */
public class ResumableBatchDriver {
    private static final Logger log = LoggerFactory.getLogger(ResumableBatchDriver.class);
    static final long IN_FLIGHT_GRACE_MS = 5_000;
    static final String INTERRUPTED_ERROR_KEY = "interrupted";

    private final String name;
    private final EnrichmentCheckpointStore checkpointStore;
    private final CrawlRunRegistry runRegistry;
    private final int workers;
    private final long perItemDelayMs;
    private final int errorSampleSize;
    private final Sleeper sleeper;

    public ResumableBatchDriver(
        String name,
        EnrichmentCheckpointStore checkpointStore,
        CrawlRunRegistry runRegistry,
        int workers,
        long perItemDelayMs,
        int errorSampleSize,
        Sleeper sleeper
    ) {
        this.name = name;
        this.checkpointStore = checkpointStore;
        this.runRegistry = runRegistry;
        this.workers = Math.max(1, workers);
        this.perItemDelayMs = Math.max(0, perItemDelayMs);
        this.errorSampleSize = Math.max(0, errorSampleSize);
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public EnrichmentCheckpoint checkpoint() {
        return checkpointStore.load();
    }

    public EnrichmentCheckpoint reset() {
        EnrichmentCheckpoint initial = EnrichmentCheckpoint.initial();
        checkpointStore.save(initial);
        log.info("Reset {} checkpoint at {}", name, checkpointStore.path());
        return initial;
    }

    public <C> BatchResult runCycle(int batchSize, CandidateSource<C> source, BatchItemHandler<C> handler, Long runId) {
        int limit = Math.max(1, batchSize);
        EnrichmentCheckpoint start = checkpointStore.load();
        long offsetBefore = start.offset();
        List<C> candidates = source.fetch(limit, offsetBefore);
        if (candidates.isEmpty()) {
            checkpointStore.save(start.withOffset(0, Instant.now()));
            log.info("{}: no candidates at offset {}, wrapping to 0", name, offsetBefore);
            return new BatchResult(0, 0, 0, 0, offsetBefore, 0, List.of(), BatchResult.STOP_EXHAUSTED);
        }

        Cycle<C> cycle = new Cycle<>(start, handler, runId);
        String stopReason = BatchResult.STOP_BATCH_DONE;
        try (BoundedWorkerPool pool = new BoundedWorkerPool(name, workers, perItemDelayMs, sleeper)) {
            try {
                for (C candidate : candidates) {
                    pool.acquireSlot();
                    String stop = cycle.stopReasonBeforeDispatch();
                    if (stop != null) {
                        pool.releaseSlot();
                        stopReason = stop;
                        break;
                    }
                    long ticket = cycle.markDispatched(candidate);
                    pool.dispatch(() -> cycle.process(candidate, ticket));
                }
                pool.awaitCompletion();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{}: interrupted while dispatching, stopping batch", name);
                stopReason = BatchResult.STOP_CANCELLED;
                if (!pool.abort(IN_FLIGHT_GRACE_MS)) {
                    log.warn("{}: in-flight items did not stop within {} ms", name, IN_FLIGHT_GRACE_MS);
                }
                cycle.failUnfinished();
            }
        }
        if (cycle.fatal.get() != null) {
            stopReason = BatchResult.STOP_FATAL;
            if (runId != null) {
                RuntimeException fatal = cycle.fatal.get();
                String lastError = handler.errorKey(fatal) + ": " + fatal.getMessage();
                runRegistry.tryTransition(runId, CrawlRunStatus.FAILED, lastError);
            }
        }

        long offsetAfter = offsetBefore + cycle.submitted.get();
        EnrichmentCheckpoint finalCheckpoint = cycle.finish(offsetAfter);
        checkpointStore.save(finalCheckpoint);
        int succeeded = cycle.succeeded.get();
        int failed = cycle.failed.get();
        log.info(
            "{}: batch finished ({}) candidates={} succeeded={} failed={} offset {} -> {}",
            name,
            stopReason,
            candidates.size(),
            succeeded,
            failed,
            offsetBefore,
            offsetAfter
        );
        return new BatchResult(
            candidates.size(),
            succeeded + failed,
            succeeded,
            failed,
            offsetBefore,
            offsetAfter,
            cycle.errorSample(),
            stopReason
        );
    }

    static boolean isFatal(RuntimeException e) {
        return e instanceof CatalogFetchException fetch && fetch.kind().isFatalForRun();
    }

    private final class Cycle<C> {
        private final BatchItemHandler<C> handler;
        private final Long runId;
        private final long offsetBefore;
        private final AtomicInteger submitted = new AtomicInteger();
        private final AtomicInteger succeeded = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicReference<RuntimeException> fatal = new AtomicReference<>();
        private final AtomicLong totalEnriched;
        private final AtomicLong totalFailed;
        private final List<ItemError> errors = new ArrayList<>();
        private final Map<Long, String> pending = new ConcurrentHashMap<>();

        private Cycle(EnrichmentCheckpoint start, BatchItemHandler<C> handler, Long runId) {
            this.handler = handler;
            this.runId = runId;
            this.offsetBefore = start.offset();
            this.totalEnriched = new AtomicLong(start.totalEnriched());
            this.totalFailed = new AtomicLong(start.totalFailed());
        }

        private String stopReasonBeforeDispatch() {
            if (fatal.get() != null) {
                return BatchResult.STOP_FATAL;
            }
            if (runId == null) {
                return null;
            }
            CrawlRunStatus status = runRegistry.status(runId);
            return switch (status) {
                case RUNNING -> null;
                case PAUSED -> BatchResult.STOP_PAUSED;
                case CANCELLED -> BatchResult.STOP_CANCELLED;
                case COMPLETED, FAILED -> BatchResult.STOP_FATAL;
            };
        }

        private long markDispatched(C candidate) {
            long ticket = submitted.incrementAndGet();
            pending.put(ticket, handler.key(candidate));
            return ticket;
        }

        private void process(C candidate, long ticket) {
            String key = handler.key(candidate);
            RuntimeException failure = null;
            try {
                handler.process(candidate);
            } catch (RuntimeException e) {
                failure = e;
            }
            // An item given up on after an interrupt was already counted as failed.
            if (pending.remove(ticket) == null) {
                return;
            }
            if (failure == null) {
                succeeded.incrementAndGet();
                totalEnriched.incrementAndGet();
                if (runId != null) {
                    runRegistry.incrementCompleted(runId);
                }
            } else {
                recordFailure(key, failure);
            }
            saveProgress();
        }

        private void recordFailure(String key, RuntimeException e) {
            if (isFatal(e)) {
                fatal.compareAndSet(null, e);
                log.error("{}: fatal failure on {}, stopping dispatch", name, key, e);
            } else {
                log.warn("{}: item {} failed: {}", name, key, e.getMessage());
            }
            countFailure(key, handler.errorKey(e), e.getMessage());
        }

        private void countFailure(String key, String errorKey, String message) {
            addError(new ItemError(key, errorKey, message));
            if (runId != null) {
                runRegistry.recordError(runId, key + ": " + errorKey + ": " + message);
            }
            failed.incrementAndGet();
            totalFailed.incrementAndGet();
        }

        /**
         * Counts every dispatched item that has not finished as failed, so each attempted item lands in exactly one
         * of the succeeded and failed totals.
         */
        private void failUnfinished() {
            for (Long ticket : List.copyOf(pending.keySet())) {
                String key = pending.remove(ticket);
                if (key != null) {
                    countFailure(key, INTERRUPTED_ERROR_KEY, "batch interrupted before the item finished");
                }
            }
            saveProgress();
        }

        private void saveProgress() {
            synchronized (this) {
                checkpointStore.save(snapshot(offsetBefore + submitted.get()));
            }
        }

        private EnrichmentCheckpoint snapshot(long offset) {
            return new EnrichmentCheckpoint(offset, totalEnriched.get(), totalFailed.get(), Instant.now());
        }

        private EnrichmentCheckpoint finish(long offset) {
            return snapshot(offset);
        }

        private void addError(ItemError error) {
            synchronized (errors) {
                if (errors.size() < errorSampleSize) {
                    errors.add(error);
                }
            }
        }

        private List<ItemError> errorSample() {
            synchronized (errors) {
                return List.copyOf(errors);
            }
        }
    }
}
