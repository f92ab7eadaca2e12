package fr.lapetina.tenantserving.domain.clock;

/**
 * Monotonic time source used for token refill, virtual deadlines and queue wait times.
 *
 * Values are only meaningful relative to each other, like {@link System#nanoTime()}.
 */
@FunctionalInterface
public interface Clock {

    /**
     * Returns the current time in nanoseconds.
     */
    long nowNanos();
}
