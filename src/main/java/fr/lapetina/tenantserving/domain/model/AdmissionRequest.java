package fr.lapetina.tenantserving.domain.model;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * A request asking for one unit of shared pool capacity on behalf of a tenant.
 * Immutable and thread-safe.
 *
 * @param requestId      unique identifier, generated when absent
 * @param tenantId       the tenant the request is charged to
 * @param cost           logical cost, charged against the token bucket and the fair queue
 * @param arrivedAtNanos arrival time on the admission clock
 * @param deadline       optional caller bound on queueing time, relative to arrival
 */
public record AdmissionRequest(
        String requestId,
        String tenantId,
        double cost,
        long arrivedAtNanos,
        Duration deadline
) {
    public static final double DEFAULT_COST = 1.0;

    public AdmissionRequest {
        Objects.requireNonNull(tenantId, "Tenant ID is required");
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant ID must not be blank");
        }
        if (Double.isNaN(cost) || Double.isInfinite(cost) || cost <= 0) {
            throw new IllegalArgumentException("Cost must be a finite value > 0, got " + cost);
        }
        if (deadline != null && deadline.isNegative()) {
            throw new IllegalArgumentException("Deadline must not be negative, got " + deadline);
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
    }

    public static AdmissionRequest of(String tenantId, double cost, long arrivedAtNanos) {
        return new AdmissionRequest(null, tenantId, cost, arrivedAtNanos, null);
    }

    /**
     * Returns the absolute time after which the request must no longer wait in the queue,
     * combining the policy's max wait with the caller's own deadline.
     */
    public long queueDeadlineNanos(TenantPolicy policy) {
        Duration wait = policy.maxWait();
        if (deadline != null && deadline.compareTo(wait) < 0) {
            wait = deadline;
        }
        try {
            return Math.addExact(arrivedAtNanos, wait.toNanos());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
