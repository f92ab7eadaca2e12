package fr.lapetina.tenantserving.infrastructure.pool;

import fr.lapetina.tenantserving.domain.model.PoolCapacity;
import fr.lapetina.tenantserving.domain.model.PoolLease;

import java.util.Optional;

/**
 * Shared backend capacity handed out as leases.
 *
 * Implementations must make acquire and release linearizable: a capacity unit is never
 * handed out twice and never lost, and a released unit is available to the next acquire.
 */
public interface ResourcePool extends AutoCloseable {

    /**
     * Identifier used in logs and health output.
     */
    String getName();

    /**
     * Takes one capacity unit if one is free. Never blocks.
     *
     * @return the lease, or empty when the pool is full, closed or unhealthy
     */
    Optional<PoolLease> tryAcquire(String tenantId, String requestId);

    /**
     * Gives a capacity unit back.
     *
     * @throws LeaseAccountingException if the lease is unknown to this pool or already released
     */
    void release(PoolLease lease);

    PoolCapacity capacity();

    /**
     * Whether the pool can hand out leases at all. A full but healthy pool is available.
     */
    boolean isAvailable();

    /**
     * Stops handing out leases. Outstanding leases can still be released.
     */
    @Override
    void close();
}
