package fr.lapetina.tenantserving.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single thread that drains the fair queue.
 *
 * Runs on demand ({@link #signal()}, coalesced while a run is pending) and periodically,
 * so that deadlines expire even when no capacity event arrives.
 */
final class DispatchLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private final Runnable drain;
    private final Duration sweepInterval;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean pending = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);

    DispatchLoop(Runnable drain, Duration sweepInterval) {
        this.drain = drain;
        this.sweepInterval = sweepInterval;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dispatch-loop");
            t.setDaemon(true);
            return t;
        });
    }

    void start() {
        if (running.compareAndSet(false, true)) {
            long intervalMs = Math.max(1, sweepInterval.toMillis());
            executor.scheduleWithFixedDelay(this::runDrain, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("Dispatch loop started: sweepIntervalMs={}", intervalMs);
        }
    }

    /**
     * Requests a drain. Several signals arriving before the drain runs produce one run.
     */
    void signal() {
        if (!pending.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(() -> {
                pending.set(false);
                runDrain();
            });
        } catch (RejectedExecutionException e) {
            pending.set(false);
            log.debug("Dispatch loop stopped, signal ignored");
        }
    }

    private void runDrain() {
        try {
            drain.run();
        } catch (Exception e) {
            log.error("Dispatch loop iteration failed", e);
        }
    }

    @Override
    public void close() {
        running.set(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Dispatch loop did not stop in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Dispatch loop stopped");
    }
}
