package fr.lapetina.tenantserving.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Handle on one occupied unit of shared pool capacity.
 *
 * A lease is handed out once by a {@code ResourcePool} and must be given back exactly once
 * through {@code AdmissionController.complete(PoolLease)}.
 *
 * @param leaseId    unique lease identifier
 * @param resourceId the slot or worker node backing this lease
 * @param tenantId   the tenant holding the lease
 * @param requestId  the request the lease was granted to
 * @param acquiredAt wall-clock acquisition time, for diagnostics
 */
public record PoolLease(
        String leaseId,
        String resourceId,
        String tenantId,
        String requestId,
        Instant acquiredAt
) {
    public PoolLease {
        Objects.requireNonNull(leaseId, "Lease ID is required");
        Objects.requireNonNull(resourceId, "Resource ID is required");
        Objects.requireNonNull(tenantId, "Tenant ID is required");
        Objects.requireNonNull(requestId, "Request ID is required");
        if (acquiredAt == null) {
            acquiredAt = Instant.now();
        }
    }
}
