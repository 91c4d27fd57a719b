package com.flagship.payment_processor.processing;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Runs per-client work either inline or on lanes partitioned by client id.
 *
 * Every client maps to exactly one single-threaded lane, so work for one client runs in
 * submission order while different clients run concurrently. With one lane the work runs
 * on the calling thread.
 *
 * Work that throws is logged and counted in {@link #getFailureCount()}; it never stops the
 * lane or the caller, and later work for the same client still runs.
 */
@Slf4j
public class EventDispatcher implements AutoCloseable {

    private final List<ExecutorService> lanes;
    private final LongAdder failures = new LongAdder();

    public EventDispatcher(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
        this.lanes = new ArrayList<>();
        if (workers > 1) {
            for (int i = 0; i < workers; i++) {
                int lane = i;
                lanes.add(Executors.newSingleThreadExecutor(task -> {
                    Thread thread = new Thread(task, "ledger-lane-" + lane);
                    thread.setDaemon(true);
                    return thread;
                }));
            }
        }
    }

    /**
     * Runs {@code work} on the lane owning {@code clientId}.
     */
    public void dispatch(int clientId, Runnable work) {
        Runnable guarded = () -> runGuarded(clientId, work);
        if (lanes.isEmpty()) {
            guarded.run();
            return;
        }
        lanes.get(clientId % lanes.size()).execute(guarded);
    }

    /**
     * Number of dispatched pieces of work that ended with an exception. Complete once
     * {@link #close()} has returned.
     */
    public long getFailureCount() {
        return failures.sum();
    }

    private void runGuarded(int clientId, Runnable work) {
        try {
            work.run();
        } catch (RuntimeException e) {
            failures.increment();
            log.error("Work for client {} failed on {}", clientId, Thread.currentThread().getName(), e);
        }
    }

    /**
     * Waits until every dispatched piece of work has finished.
     */
    @Override
    public void close() {
        for (ExecutorService lane : lanes) {
            lane.shutdown();
        }
        try {
            for (ExecutorService lane : lanes) {
                while (!lane.awaitTermination(1, TimeUnit.SECONDS)) {
                    log.debug("Waiting for ledger lanes to drain");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lanes.forEach(ExecutorService::shutdownNow);
            throw new IllegalStateException("Interrupted while draining ledger lanes", e);
        }
    }
}
