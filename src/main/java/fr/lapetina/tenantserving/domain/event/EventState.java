package fr.lapetina.tenantserving.domain.event;

/**
 * Progress of an admission event through the ingress pipeline.
 */
public enum EventState {
    /** Event just published, awaiting policy resolution */
    CREATED,

    /** Tenant policy resolved */
    POLICY_RESOLVED,

    /** Tenant is below its in-flight quota */
    QUOTA_CHECKED,

    /** Token bucket paid, or payment deferred to the queue */
    RATE_CHECKED,

    /** A lease was granted */
    DISPATCHED,

    /** Waiting in the fair queue */
    QUEUED,

    /** Refused; the rejection status is set on the event */
    REJECTED,

    /** Cancelled by the caller before a decision */
    CANCELLED
}
