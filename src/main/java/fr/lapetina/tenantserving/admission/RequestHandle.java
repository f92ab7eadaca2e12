package fr.lapetina.tenantserving.admission;

import fr.lapetina.tenantserving.domain.model.AdmissionOutcome;
import fr.lapetina.tenantserving.domain.model.AdmissionRequest;
import fr.lapetina.tenantserving.domain.queue.FairQueueEntry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Caller-side handle on a submitted request.
 *
 * State transitions are CAS operations: exactly one terminal transition wins, and the
 * winner completes the {@link #outcome()} future. Every other racer (a cancel against a
 * dispatch, a timeout against a cancel) observes the lost CAS and backs off.
 */
public final class RequestHandle {

    private final AdmissionRequest request;
    private final Predicate<RequestHandle> canceller;
    private final AtomicReference<RequestState> state = new AtomicReference<>(RequestState.ARRIVED);
    private final CompletableFuture<AdmissionOutcome> outcome = new CompletableFuture<>();

    private volatile FairQueueEntry<RequestHandle> queueEntry;
    private volatile long queuedAtNanos;

    public RequestHandle(AdmissionRequest request, Predicate<RequestHandle> canceller) {
        this.request = Objects.requireNonNull(request, "Request is required");
        this.canceller = Objects.requireNonNull(canceller, "Canceller is required");
    }

    public String requestId() {
        return request.requestId();
    }

    public String tenantId() {
        return request.tenantId();
    }

    public AdmissionRequest request() {
        return request;
    }

    public RequestState state() {
        return state.get();
    }

    public boolean isDone() {
        return state.get().isTerminal();
    }

    /**
     * Completes with the admission outcome: a lease, a rejection, a timeout or a cancellation.
     */
    public CompletableFuture<AdmissionOutcome> outcome() {
        return outcome;
    }

    /**
     * Cancels the request if it has not been dispatched yet. Idempotent.
     *
     * @return true if this call cancelled the request
     */
    public boolean cancel() {
        return canceller.test(this);
    }

    /**
     * Records the queue entry before the QUEUED transition, so a concurrent cancel can find it.
     */
    void attach(FairQueueEntry<RequestHandle> entry) {
        this.queueEntry = entry;
    }

    void markQueuedAt(long nowNanos) {
        this.queuedAtNanos = nowNanos;
    }

    FairQueueEntry<RequestHandle> queueEntry() {
        return queueEntry;
    }

    long queuedAtNanos() {
        return queuedAtNanos;
    }

    boolean markQueued() {
        return state.compareAndSet(RequestState.ARRIVED, RequestState.QUEUED);
    }

    /**
     * Moves to the terminal state matching the outcome and completes the future.
     *
     * @return false if another terminal transition already won
     */
    public boolean complete(AdmissionOutcome result) {
        RequestState target = terminalStateOf(result);
        while (true) {
            RequestState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, target)) {
                outcome.complete(result);
                return true;
            }
        }
    }

    /**
     * Fails the outcome future after an internal error.
     *
     * @return false if the request already reached a terminal state
     */
    public boolean fail(Throwable error) {
        while (true) {
            RequestState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, RequestState.REJECTED)) {
                outcome.completeExceptionally(error);
                return true;
            }
        }
    }

    private static RequestState terminalStateOf(AdmissionOutcome result) {
        return switch (result.status()) {
            case DISPATCHED -> RequestState.DISPATCHED;
            case TIMEOUT -> RequestState.TIMED_OUT;
            case CANCELLED -> RequestState.CANCELLED;
            default -> RequestState.REJECTED;
        };
    }

    @Override
    public String toString() {
        return "RequestHandle{" +
                "requestId=" + request.requestId() +
                ", tenantId=" + request.tenantId() +
                ", state=" + state.get() +
                '}';
    }
}
