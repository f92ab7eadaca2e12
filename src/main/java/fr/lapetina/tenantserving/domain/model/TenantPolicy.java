package fr.lapetina.tenantserving.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Admission policy of a tenant.
 * Immutable and thread-safe: a policy change replaces the whole snapshot.
 *
 * @param weight           share of dispatch bandwidth relative to other tenants (at least 1)
 * @param maxConcurrent    maximum number of dispatched requests in flight at once (at least 1)
 * @param ratePerSecond    sustained token refill rate, {@link Double#POSITIVE_INFINITY} for unlimited
 * @param burst            token bucket capacity
 * @param maxWait          how long a request may wait in the fair queue
 * @param queueOnRateLimit whether a rate-limited request is queued instead of rejected
 */
public record TenantPolicy(
        int weight,
        int maxConcurrent,
        double ratePerSecond,
        double burst,
        Duration maxWait,
        boolean queueOnRateLimit
) {
    public static final int DEFAULT_WEIGHT = 1;
    public static final int DEFAULT_MAX_CONCURRENT = 10;
    public static final double UNLIMITED_RATE = Double.POSITIVE_INFINITY;
    public static final double DEFAULT_BURST = 1.0;
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(30);

    public TenantPolicy {
        if (weight < 1) {
            throw new IllegalArgumentException("weight must be >= 1, got " + weight);
        }
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, got " + maxConcurrent);
        }
        if (Double.isNaN(ratePerSecond) || ratePerSecond <= 0) {
            throw new IllegalArgumentException("ratePerSecond must be > 0, got " + ratePerSecond);
        }
        if (Double.isNaN(burst) || burst <= 0 || Double.isInfinite(burst)) {
            throw new IllegalArgumentException("burst must be a finite value > 0, got " + burst);
        }
        Objects.requireNonNull(maxWait, "maxWait is required");
        if (maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must not be negative, got " + maxWait);
        }
    }

    /**
     * The policy applied to tenants nobody configured.
     */
    public static TenantPolicy defaults() {
        return builder().build();
    }

    public boolean isRateUnlimited() {
        return Double.isInfinite(ratePerSecond);
    }

    /**
     * Returns a builder pre-filled with this policy's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .weight(weight)
                .maxConcurrent(maxConcurrent)
                .ratePerSecond(ratePerSecond)
                .burst(burst)
                .maxWait(maxWait)
                .queueOnRateLimit(queueOnRateLimit);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int weight = DEFAULT_WEIGHT;
        private int maxConcurrent = DEFAULT_MAX_CONCURRENT;
        private double ratePerSecond = UNLIMITED_RATE;
        private double burst = DEFAULT_BURST;
        private Duration maxWait = DEFAULT_MAX_WAIT;
        private boolean queueOnRateLimit;

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder ratePerSecond(double ratePerSecond) {
            this.ratePerSecond = ratePerSecond;
            return this;
        }

        public Builder unlimitedRate() {
            this.ratePerSecond = UNLIMITED_RATE;
            return this;
        }

        public Builder burst(double burst) {
            this.burst = burst;
            return this;
        }

        public Builder maxWait(Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        public Builder queueOnRateLimit(boolean queueOnRateLimit) {
            this.queueOnRateLimit = queueOnRateLimit;
            return this;
        }

        public TenantPolicy build() {
            return new TenantPolicy(weight, maxConcurrent, ratePerSecond, burst, maxWait, queueOnRateLimit);
        }
    }
}
