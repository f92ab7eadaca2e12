package fr.lapetina.tenantserving.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Result delivered through a request handle.
 * Immutable and thread-safe.
 *
 * @param requestId the request this outcome belongs to
 * @param tenantId  the tenant the request was charged to
 * @param status    what happened to the request
 * @param lease     the granted lease, only for {@link OutcomeStatus#DISPATCHED}
 * @param message   human readable detail, null when dispatched
 * @param queuedFor time spent in the fair queue, zero when never queued
 */
public record AdmissionOutcome(
        String requestId,
        String tenantId,
        OutcomeStatus status,
        PoolLease lease,
        String message,
        Duration queuedFor
) {
    public AdmissionOutcome {
        Objects.requireNonNull(requestId, "Request ID is required");
        Objects.requireNonNull(status, "Status is required");
        if (status == OutcomeStatus.DISPATCHED && lease == null) {
            throw new IllegalArgumentException("A dispatched outcome requires a lease");
        }
        if (status != OutcomeStatus.DISPATCHED && lease != null) {
            throw new IllegalArgumentException("Only a dispatched outcome carries a lease");
        }
        if (queuedFor == null) {
            queuedFor = Duration.ZERO;
        }
    }

    public boolean isDispatched() {
        return status == OutcomeStatus.DISPATCHED;
    }

    public boolean isRejected() {
        return status.isRejection();
    }

    public static AdmissionOutcome dispatched(AdmissionRequest request, PoolLease lease, Duration queuedFor) {
        return new AdmissionOutcome(
                request.requestId(), request.tenantId(), OutcomeStatus.DISPATCHED, lease, null, queuedFor
        );
    }

    public static AdmissionOutcome rejected(
            AdmissionRequest request,
            OutcomeStatus status,
            String message,
            Duration queuedFor
    ) {
        return new AdmissionOutcome(
                request.requestId(), request.tenantId(), status, null, message, queuedFor
        );
    }

    public static AdmissionOutcome rejected(AdmissionRequest request, OutcomeStatus status, String message) {
        return rejected(request, status, message, Duration.ZERO);
    }
}
