package com.spa.aggregator.crawl.batch;

import com.spa.aggregator.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed number of worker threads with blocking hand-off: a slot must be acquired before dispatching, so the
 * dispatcher waits while every worker is busy. Each worker pauses {@code perItemDelayMs} after its item.
 */
public class BoundedWorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BoundedWorkerPool.class);

    private final ExecutorService executor;
    private final Semaphore slots;
    private final long perItemDelayMs;
    private final Sleeper sleeper;

    public BoundedWorkerPool(String name, int workers, long perItemDelayMs, Sleeper sleeper) {
        int size = Math.max(1, workers);
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(size, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(name + "-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.slots = new Semaphore(size);
        this.perItemDelayMs = Math.max(0, perItemDelayMs);
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public void acquireSlot() throws InterruptedException {
        slots.acquire();
    }

    public void releaseSlot() {
        slots.release();
    }

    /**
     * Runs the task on a worker. The caller must hold a slot from {@link #acquireSlot()}; it is released when the
     * task and its trailing delay finish.
     */
    public void dispatch(Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } finally {
                try {
                    sleeper.sleep(perItemDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    slots.release();
                }
            }
        });
    }

    /**
     * Waits for all dispatched work to finish.
     */
    public void awaitCompletion() throws InterruptedException {
        executor.shutdown();
        while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
            log.info("Waiting for in-flight batch items to finish");
        }
    }

    /**
     * Interrupts running items and waits up to {@code timeoutMs} for the workers to exit. The caller's interrupt
     * status is preserved.
     *
     * @return whether every worker exited in time
     */
    public boolean abort(long timeoutMs) {
        executor.shutdownNow();
        boolean interrupted = Thread.interrupted();
        try {
            return executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            interrupted = true;
            return executor.isTerminated();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
