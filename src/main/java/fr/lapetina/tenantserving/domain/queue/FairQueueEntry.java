package fr.lapetina.tenantserving.domain.queue;

import fr.lapetina.tenantserving.domain.model.TenantPolicy;

import java.util.Comparator;
import java.util.Objects;

/**
 * A request waiting in the {@link WeightedFairQueue}.
 *
 * Carries the policy snapshot taken at enqueue: a later policy change does not
 * affect entries that are already waiting. Equality is identity.
 *
 * @param <T> the caller's payload (typically the request handle)
 */
public final class FairQueueEntry<T> {

    /**
     * Smallest virtual finish time first, then earliest arrival, then tenant ID.
     */
    static final Comparator<FairQueueEntry<?>> ORDER = Comparator
            .<FairQueueEntry<?>>comparingDouble(FairQueueEntry::getVirtualFinishTime)
            .thenComparingLong(FairQueueEntry::getSequence)
            .thenComparing(FairQueueEntry::getTenantId);

    private final T payload;
    private final String tenantId;
    private final double cost;
    private final TenantPolicy policy;
    private final long deadlineNanos;
    private final double virtualFinishTime;
    private final long sequence;
    private volatile boolean rateOwed;

    FairQueueEntry(
            T payload,
            String tenantId,
            double cost,
            TenantPolicy policy,
            long deadlineNanos,
            boolean rateOwed,
            double virtualFinishTime,
            long sequence
    ) {
        this.payload = Objects.requireNonNull(payload, "Payload is required");
        this.tenantId = Objects.requireNonNull(tenantId, "Tenant ID is required");
        this.cost = cost;
        this.policy = Objects.requireNonNull(policy, "Policy is required");
        this.deadlineNanos = deadlineNanos;
        this.rateOwed = rateOwed;
        this.virtualFinishTime = virtualFinishTime;
        this.sequence = sequence;
    }

    public T getPayload() {
        return payload;
    }

    public String getTenantId() {
        return tenantId;
    }

    public double getCost() {
        return cost;
    }

    public TenantPolicy getPolicy() {
        return policy;
    }

    public long getDeadlineNanos() {
        return deadlineNanos;
    }

    public boolean isExpired(long nowNanos) {
        return nowNanos > deadlineNanos;
    }

    public double getVirtualFinishTime() {
        return virtualFinishTime;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * Whether the token bucket has yet to be charged for this entry
     * (queued because of a rate limit under a queue-on-limit policy).
     */
    public boolean isRateOwed() {
        return rateOwed;
    }

    public void markRateCharged() {
        this.rateOwed = false;
    }

    @Override
    public String toString() {
        return "FairQueueEntry{" +
                "tenantId='" + tenantId + '\'' +
                ", cost=" + cost +
                ", vft=" + virtualFinishTime +
                ", seq=" + sequence +
                ", rateOwed=" + rateOwed +
                '}';
    }
}
