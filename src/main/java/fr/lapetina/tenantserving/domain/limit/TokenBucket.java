package fr.lapetina.tenantserving.domain.limit;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket owned by a single tenant.
 *
 * Tokens accumulate at {@code ratePerSecond} up to {@code burst} and are spent per request.
 * Rate and burst are passed on every call so that a policy change is picked up by the next
 * decision; when the burst shrinks the balance is clamped to the new capacity.
 *
 * Thread-safety: refill and consumption happen under a per-bucket lock, so two concurrent
 * calls for the same tenant never observe an intermediate balance. Contention is scoped to
 * one tenant.
 */
public final class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private double burst;
    private long lastRefillNanos;
    private boolean initialized;

    /**
     * Attempts to take {@code cost} tokens.
     *
     * @return true if the tokens were taken, false if the balance would go negative
     *         (the balance is then left untouched apart from refill)
     */
    public boolean tryConsume(double ratePerSecond, double burst, double cost, long nowNanos) {
        lock.lock();
        try {
            refill(ratePerSecond, burst, nowNanos);
            if (tokens - cost < 0) {
                return false;
            }
            tokens -= cost;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns how long until {@code cost} tokens are available, 0 if they already are,
     * {@link Long#MAX_VALUE} if the cost exceeds the burst and can never be paid.
     */
    public long nanosUntilAvailable(double ratePerSecond, double burst, double cost, long nowNanos) {
        lock.lock();
        try {
            refill(ratePerSecond, burst, nowNanos);
            if (cost > burst) {
                return Long.MAX_VALUE;
            }
            double missing = cost - tokens;
            if (missing <= 0) {
                return 0L;
            }
            return (long) Math.ceil(missing / ratePerSecond * NANOS_PER_SECOND);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current balance, after refilling up to {@code nowNanos}.
     */
    public double available(double ratePerSecond, double burst, long nowNanos) {
        lock.lock();
        try {
            refill(ratePerSecond, burst, nowNanos);
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    private void refill(double ratePerSecond, double newBurst, long nowNanos) {
        if (!initialized) {
            // Buckets start full
            tokens = newBurst;
            burst = newBurst;
            lastRefillNanos = nowNanos;
            initialized = true;
            return;
        }

        if (newBurst != burst) {
            burst = newBurst;
            tokens = Math.min(tokens, burst);
        }

        long elapsed = nowNanos - lastRefillNanos;
        if (elapsed <= 0) {
            // Never refill backwards
            return;
        }
        tokens = Math.min(burst, tokens + elapsed * ratePerSecond / NANOS_PER_SECOND);
        lastRefillNanos = nowNanos;
    }
}
