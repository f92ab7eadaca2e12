package fr.lapetina.tenantserving.admission;

/**
 * Lifecycle of an admission request.
 *
 * <pre>
 * ARRIVED -> DISPATCHED | QUEUED | REJECTED | CANCELLED
 * QUEUED  -> DISPATCHED | TIMED_OUT | REJECTED | CANCELLED
 * </pre>
 */
public enum RequestState {
    /** Accepted into the ingress ring buffer, no decision yet */
    ARRIVED,

    /** Waiting in the fair queue for capacity */
    QUEUED,

    /** A lease was granted */
    DISPATCHED,

    /** Refused by quota, rate, pool or registration checks */
    REJECTED,

    /** Waited past its deadline */
    TIMED_OUT,

    /** Cancelled by the caller before dispatch */
    CANCELLED;

    public boolean isTerminal() {
        return this != ARRIVED && this != QUEUED;
    }
}
