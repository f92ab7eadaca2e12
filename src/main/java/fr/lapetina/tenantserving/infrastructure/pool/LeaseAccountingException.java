package fr.lapetina.tenantserving.infrastructure.pool;

/**
 * Raised by a pool when a lease is released twice, released to the wrong pool,
 * or would drive capacity negative. Signals a collaborator contract violation.
 */
public final class LeaseAccountingException extends RuntimeException {

    private final String leaseId;

    public LeaseAccountingException(String leaseId, String message) {
        super("Lease accounting violation: " + message + " (leaseId=" + leaseId + ")");
        this.leaseId = leaseId;
    }

    public String getLeaseId() {
        return leaseId;
    }
}
