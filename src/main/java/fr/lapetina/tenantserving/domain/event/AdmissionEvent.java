package fr.lapetina.tenantserving.domain.event;

import fr.lapetina.tenantserving.admission.RequestHandle;
import fr.lapetina.tenantserving.domain.model.AdmissionRequest;
import fr.lapetina.tenantserving.domain.model.OutcomeStatus;
import fr.lapetina.tenantserving.domain.model.TenantPolicy;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * Each handler stage updates the event as it progresses through the pipeline.
 *
 * IMPORTANT: This class is intentionally mutable for Disruptor performance.
 * It should never be accessed outside the Disruptor pipeline handlers.
 */
public final class AdmissionEvent {

    /** Marks a stage timestamp that was never reached */
    public static final long UNSET = Long.MIN_VALUE;

    private RequestHandle handle;

    // Mutable state tracking
    private EventState state;
    private TenantPolicy policy;
    private boolean rateOwed;
    private OutcomeStatus rejection;
    private String rejectionMessage;

    // Timing, on the admission clock
    private long acceptedAtNanos;
    private long policyResolvedAtNanos;
    private long quotaCheckedAtNanos;
    private long rateCheckedAtNanos;
    private long decidedAtNanos;

    // Sequence number (set by Disruptor)
    private long sequence;

    public AdmissionEvent() {
        clear();
    }

    /**
     * Clears the event for reuse.
     * Called by the EventFactory and at the end of processing.
     */
    public void clear() {
        this.handle = null;
        this.state = null;
        this.policy = null;
        this.rateOwed = false;
        this.rejection = null;
        this.rejectionMessage = null;
        this.acceptedAtNanos = UNSET;
        this.policyResolvedAtNanos = UNSET;
        this.quotaCheckedAtNanos = UNSET;
        this.rateCheckedAtNanos = UNSET;
        this.decidedAtNanos = UNSET;
        this.sequence = -1;
    }

    /**
     * Initializes the event with a new request.
     */
    public void initialize(RequestHandle handle, long nowNanos) {
        clear();
        this.handle = handle;
        this.state = EventState.CREATED;
        this.acceptedAtNanos = nowNanos;
    }

    public RequestHandle getHandle() {
        return handle;
    }

    public AdmissionRequest getRequest() {
        return handle != null ? handle.request() : null;
    }

    public EventState getState() {
        return state;
    }

    public TenantPolicy getPolicy() {
        return policy;
    }

    public boolean isRateOwed() {
        return rateOwed;
    }

    public OutcomeStatus getRejection() {
        return rejection;
    }

    public String getRejectionMessage() {
        return rejectionMessage;
    }

    public long getAcceptedAtNanos() {
        return acceptedAtNanos;
    }

    public long getPolicyResolvedAtNanos() {
        return policyResolvedAtNanos;
    }

    public long getQuotaCheckedAtNanos() {
        return quotaCheckedAtNanos;
    }

    public long getRateCheckedAtNanos() {
        return rateCheckedAtNanos;
    }

    public long getDecidedAtNanos() {
        return decidedAtNanos;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markPolicyResolved(TenantPolicy policy, long nowNanos) {
        this.policy = policy;
        this.state = EventState.POLICY_RESOLVED;
        this.policyResolvedAtNanos = nowNanos;
    }

    public void markQuotaChecked(long nowNanos) {
        this.state = EventState.QUOTA_CHECKED;
        this.quotaCheckedAtNanos = nowNanos;
    }

    public void markRateChecked(boolean rateOwed, long nowNanos) {
        this.rateOwed = rateOwed;
        this.state = EventState.RATE_CHECKED;
        this.rateCheckedAtNanos = nowNanos;
    }

    public void markDispatched(long nowNanos) {
        this.state = EventState.DISPATCHED;
        this.decidedAtNanos = nowNanos;
    }

    public void markQueued(long nowNanos) {
        this.state = EventState.QUEUED;
        this.decidedAtNanos = nowNanos;
    }

    public void markCancelled(long nowNanos) {
        this.state = EventState.CANCELLED;
        this.decidedAtNanos = nowNanos;
    }

    public void reject(OutcomeStatus status, String message, long nowNanos) {
        this.state = EventState.REJECTED;
        this.rejection = status;
        this.rejectionMessage = message;
        this.decidedAtNanos = nowNanos;
    }

    /**
     * Checks if the admission decision has been taken.
     */
    public boolean isDecided() {
        return state == EventState.DISPATCHED
            || state == EventState.QUEUED
            || state == EventState.REJECTED
            || state == EventState.CANCELLED;
    }

    /**
     * Checks if processing should skip remaining decision stages: either a decision exists
     * or the caller already cancelled the handle.
     */
    public boolean shouldSkip() {
        return handle == null || isDecided() || handle.isDone();
    }

    @Override
    public String toString() {
        return "AdmissionEvent{" +
                "requestId=" + (handle != null ? handle.requestId() : "null") +
                ", tenantId=" + (handle != null ? handle.tenantId() : "null") +
                ", state=" + state +
                ", rejection=" + rejection +
                ", seq=" + sequence +
                '}';
    }
}
