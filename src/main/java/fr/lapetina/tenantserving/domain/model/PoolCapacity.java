package fr.lapetina.tenantserving.domain.model;

/**
 * Point-in-time view of pool occupancy.
 *
 * @param used  leases currently held
 * @param total capacity units currently offered
 */
public record PoolCapacity(int used, int total) {

    public int free() {
        return Math.max(0, total - used);
    }

    public boolean hasFree() {
        return used < total;
    }
}
