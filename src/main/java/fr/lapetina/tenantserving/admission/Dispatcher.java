package fr.lapetina.tenantserving.admission;

import fr.lapetina.tenantserving.domain.clock.Clock;
import fr.lapetina.tenantserving.domain.limit.TokenBucketLimiter;
import fr.lapetina.tenantserving.domain.model.AdmissionOutcome;
import fr.lapetina.tenantserving.domain.model.AdmissionRequest;
import fr.lapetina.tenantserving.domain.model.OutcomeStatus;
import fr.lapetina.tenantserving.domain.model.PoolLease;
import fr.lapetina.tenantserving.domain.model.TenantPolicy;
import fr.lapetina.tenantserving.domain.queue.FairQueueEntry;
import fr.lapetina.tenantserving.domain.queue.WeightedFairQueue;
import fr.lapetina.tenantserving.domain.tenant.TenantRegistry;
import fr.lapetina.tenantserving.domain.tenant.TenantState;
import fr.lapetina.tenantserving.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.tenantserving.infrastructure.pool.LeaseAccountingException;
import fr.lapetina.tenantserving.infrastructure.pool.ResourcePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns admitted requests into leases.
 *
 * Owns the fair queue and the table of outstanding leases. New arrivals go through
 * {@link #admit}; queued requests are served by {@link #drain()}, which only ever runs on
 * the dispatch loop thread. Every dispatch reserves the tenant's in-flight unit first
 * (CAS bounded by the quota), then the pool lease, then wins the handle's DISPATCHED
 * transition; a failure at any step undoes the previous ones.
 */
public final class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    /**
     * Result of {@link #admit}.
     */
    public enum Admission {
        DISPATCHED,
        QUEUED,
        QUOTA_EXCEEDED,
        POOL_UNAVAILABLE,
        CANCELLED
    }

    private enum Step {
        PROGRESS,
        NO_CAPACITY,
        NOTHING_ELIGIBLE
    }

    private final TenantRegistry registry;
    private final TokenBucketLimiter limiter;
    private final ResourcePool pool;
    private final RequestBackend backend;
    private final Clock clock;
    private final MetricsRegistry metrics;
    private final WeightedFairQueue<RequestHandle> queue = new WeightedFairQueue<>();
    private final Map<String, TenantState> activeLeases = new ConcurrentHashMap<>();

    private volatile Runnable wakeUp = () -> { };
    private volatile boolean closed;

    public Dispatcher(
            TenantRegistry registry,
            TokenBucketLimiter limiter,
            ResourcePool pool,
            RequestBackend backend,
            Clock clock,
            MetricsRegistry metrics
    ) {
        this.registry = registry;
        this.limiter = limiter;
        this.pool = pool;
        this.backend = backend;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Sets the callback that schedules a drain on the dispatch loop.
     */
    void onWakeUp(Runnable wakeUp) {
        this.wakeUp = wakeUp;
    }

    /**
     * Dispatches a request that passed the quota and rate checks, or queues it.
     *
     * The tenant's in-flight unit is reserved first, so an arrival over quota is rejected
     * even when other tenants' work is waiting. With a free lease the request dispatches at
     * once; otherwise it joins the queue. Rate-owed arrivals always queue.
     *
     * @param policy   policy snapshot resolved at arrival, kept with the queue entry
     * @param rateOwed whether the token bucket still has to be charged before dispatch
     */
    public Admission admit(RequestHandle handle, TenantPolicy policy, boolean rateOwed) {
        if (closed || !pool.isAvailable()) {
            return Admission.POOL_UNAVAILABLE;
        }

        AdmissionRequest request = handle.request();
        TenantState state = registry.stateOf(request.tenantId());

        if (!rateOwed) {
            if (!state.tryReserve(policy.maxConcurrent())) {
                return Admission.QUOTA_EXCEEDED;
            }
            Optional<PoolLease> lease = pool.tryAcquire(request.tenantId(), request.requestId());
            if (lease.isPresent()) {
                return dispatch(handle, state, lease.get(), Duration.ZERO)
                        ? Admission.DISPATCHED
                        : Admission.CANCELLED;
            }
            state.release();
        }

        return enqueue(handle, policy, rateOwed);
    }

    private Admission enqueue(RequestHandle handle, TenantPolicy policy, boolean rateOwed) {
        AdmissionRequest request = handle.request();
        long now = clock.nowNanos();
        long deadline = request.queueDeadlineNanos(policy);

        // Stamped before the entry becomes visible to the dispatch loop
        handle.markQueuedAt(now);
        FairQueueEntry<RequestHandle> entry = queue.enqueue(
                request.tenantId(), request.cost(), policy, deadline, rateOwed, handle);
        handle.attach(entry);

        if (!handle.markQueued()) {
            // Cancelled while in the ring buffer, or already served by the loop
            if (handle.state() == RequestState.CANCELLED) {
                queue.remove(entry);
                return Admission.CANCELLED;
            }
            return Admission.QUEUED;
        }

        log.debug("Request queued: requestId={}, tenantId={}, vft={}, rateOwed={}, queueSize={}",
                request.requestId(), request.tenantId(), entry.getVirtualFinishTime(), rateOwed, queue.size());
        wakeUp.run();
        return Admission.QUEUED;
    }

    private boolean dispatch(RequestHandle handle, TenantState state, PoolLease lease, Duration queuedFor) {
        AdmissionRequest request = handle.request();

        // Registered before the outcome completes: the caller may complete the lease right away
        activeLeases.put(lease.leaseId(), state);
        if (!handle.complete(AdmissionOutcome.dispatched(request, lease, queuedFor))) {
            activeLeases.remove(lease.leaseId());
            releaseToPool(lease);
            state.release();
            log.debug("Dispatch lost to a concurrent transition: requestId={}, state={}",
                    request.requestId(), handle.state());
            return false;
        }

        state.recordDispatched();
        if (!queuedFor.isZero()) {
            metrics.recordQueueWait(request.tenantId(), queuedFor);
        }
        log.info("Request dispatched: requestId={}, tenantId={}, resourceId={}, queuedMs={}, tenantInFlight={}",
                request.requestId(), request.tenantId(), lease.resourceId(),
                queuedFor.toMillis(), state.getInFlight());

        invokeBackend(request, lease);
        return true;
    }

    private void invokeBackend(AdmissionRequest request, PoolLease lease) {
        CompletionStage<?> work;
        try {
            work = backend.execute(request, lease);
        } catch (Exception e) {
            log.error("Backend rejected dispatched request: requestId={}, tenantId={}",
                    request.requestId(), request.tenantId(), e);
            complete(lease);
            return;
        }

        if (work != null) {
            work.whenComplete((result, error) -> {
                if (error != null) {
                    log.warn("Backend work failed: requestId={}, tenantId={}, error={}",
                            request.requestId(), request.tenantId(), error.getMessage());
                }
                complete(lease);
            });
        }
    }

    /**
     * Serves the queue while the pool has capacity. Runs on the dispatch loop thread only.
     */
    void drain() {
        if (closed) {
            return;
        }

        expire(clock.nowNanos());

        while (!closed && !queue.isEmpty() && pool.isAvailable() && pool.capacity().hasFree()) {
            Step step = dispatchNext();
            if (step != Step.PROGRESS) {
                break;
            }
        }
    }

    private void expire(long now) {
        List<FairQueueEntry<RequestHandle>> expired = queue.removeExpired(now);
        for (FairQueueEntry<RequestHandle> entry : expired) {
            timeOut(entry, now);
        }
    }

    private void timeOut(FairQueueEntry<RequestHandle> entry, long now) {
        RequestHandle handle = entry.getPayload();
        Duration waited = Duration.ofNanos(Math.max(0, now - handle.queuedAtNanos()));
        if (handle.complete(AdmissionOutcome.rejected(handle.request(), OutcomeStatus.TIMEOUT,
                "Waited " + waited.toMillis() + " ms in queue without capacity", waited))) {
            log.warn("Request timed out in queue: requestId={}, tenantId={}, waitedMs={}",
                    handle.requestId(), handle.tenantId(), waited.toMillis());
        }
    }

    /**
     * Dispatches the best eligible head. Tenants at their quota, or whose owed rate cost
     * cannot be paid yet, are skipped and keep their place.
     */
    private Step dispatchNext() {
        for (FairQueueEntry<RequestHandle> entry : queue.heads()) {
            long now = clock.nowNanos();
            RequestHandle handle = entry.getPayload();

            if (handle.isDone()) {
                queue.remove(entry);
                return Step.PROGRESS;
            }
            if (entry.isExpired(now)) {
                if (queue.remove(entry)) {
                    timeOut(entry, now);
                }
                return Step.PROGRESS;
            }

            String tenantId = entry.getTenantId();
            TenantPolicy policy = entry.getPolicy();
            TenantState state = registry.stateOf(tenantId);

            if (!state.tryReserve(policy.maxConcurrent())) {
                continue;
            }
            if (entry.isRateOwed()) {
                if (!limiter.tryConsume(tenantId, policy, entry.getCost())) {
                    state.release();
                    continue;
                }
                entry.markRateCharged();
            }

            Optional<PoolLease> lease = pool.tryAcquire(tenantId, handle.requestId());
            if (lease.isEmpty()) {
                state.release();
                return Step.NO_CAPACITY;
            }
            if (!queue.take(entry)) {
                releaseToPool(lease.get());
                state.release();
                return Step.PROGRESS;
            }

            Duration queuedFor = Duration.ofNanos(Math.max(0, now - handle.queuedAtNanos()));
            dispatch(handle, state, lease.get(), queuedFor);
            return Step.PROGRESS;
        }
        return Step.NOTHING_ELIGIBLE;
    }

    /**
     * Releases a dispatched lease and the tenant's in-flight unit, then wakes the loop.
     *
     * @return false for an unknown or already completed lease; the violation is logged and counted
     */
    public boolean complete(PoolLease lease) {
        TenantState state = activeLeases.remove(lease.leaseId());
        if (state == null) {
            reportViolation(lease, "unknown or already completed lease");
            return false;
        }

        boolean clean = true;
        try {
            pool.release(lease);
        } catch (LeaseAccountingException e) {
            reportViolation(lease, e.getMessage());
            clean = false;
        }
        if (!state.release()) {
            reportViolation(lease, "tenant in-flight counter already at zero");
            clean = false;
        }

        log.debug("Lease completed: leaseId={}, tenantId={}, tenantInFlight={}",
                lease.leaseId(), lease.tenantId(), state.getInFlight());
        wakeUp.run();
        return clean;
    }

    /**
     * Cancels a request that is not dispatched yet and removes its queue entry.
     */
    public boolean cancel(RequestHandle handle) {
        FairQueueEntry<RequestHandle> entry = handle.queueEntry();
        long queuedAt = handle.queuedAtNanos();
        Duration queuedFor = entry == null
                ? Duration.ZERO
                : Duration.ofNanos(Math.max(0, clock.nowNanos() - queuedAt));

        if (!handle.complete(AdmissionOutcome.rejected(
                handle.request(), OutcomeStatus.CANCELLED, "Cancelled by caller", queuedFor))) {
            return false;
        }

        entry = handle.queueEntry();
        if (entry != null) {
            queue.remove(entry);
        }
        log.info("Request cancelled: requestId={}, tenantId={}", handle.requestId(), handle.tenantId());
        return true;
    }

    /**
     * Stops dispatching and rejects every queued request with POOL_UNAVAILABLE.
     */
    void close() {
        closed = true;
        List<FairQueueEntry<RequestHandle>> remaining = queue.drainAll();
        for (FairQueueEntry<RequestHandle> entry : remaining) {
            RequestHandle handle = entry.getPayload();
            handle.complete(AdmissionOutcome.rejected(
                    handle.request(), OutcomeStatus.POOL_UNAVAILABLE, "Admission controller closed"));
        }
        if (!remaining.isEmpty()) {
            log.info("Rejected queued requests on close: count={}", remaining.size());
        }
    }

    public int queueSize() {
        return queue.size();
    }

    public int queueSize(String tenantId) {
        return queue.size(tenantId);
    }

    public double virtualTime() {
        return queue.virtualTime();
    }

    public int activeLeaseCount() {
        return activeLeases.size();
    }

    private void releaseToPool(PoolLease lease) {
        try {
            pool.release(lease);
        } catch (LeaseAccountingException e) {
            reportViolation(lease, e.getMessage());
        }
    }

    private void reportViolation(PoolLease lease, String reason) {
        metrics.incrementLeaseViolations();
        log.error("Lease accounting violation: leaseId={}, tenantId={}, requestId={}, reason={}",
                lease.leaseId(), lease.tenantId(), lease.requestId(), reason);
    }
}
