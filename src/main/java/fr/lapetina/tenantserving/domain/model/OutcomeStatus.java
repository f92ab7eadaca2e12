package fr.lapetina.tenantserving.domain.model;

/**
 * Final outcome of an admission request.
 * Each rejection cause is distinct so callers and retry policies can react differently.
 */
public enum OutcomeStatus {
    /** A pool lease was granted and the request handed to the backend */
    DISPATCHED,

    /** The tenant already had its maximum number of requests in flight */
    QUOTA_EXCEEDED,

    /** The tenant's token bucket could not pay for the request */
    RATE_LIMITED,

    /** The request waited in the fair queue past its deadline */
    TIMEOUT,

    /** The resource pool is closed or has no healthy capacity */
    POOL_UNAVAILABLE,

    /** Strict registration is on and the tenant is not registered */
    UNKNOWN_TENANT,

    /** The caller cancelled the request before it was dispatched */
    CANCELLED;

    public boolean isRejection() {
        return this != DISPATCHED && this != CANCELLED;
    }
}
