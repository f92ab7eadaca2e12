package fr.lapetina.tenantserving.admission;

import fr.lapetina.tenantserving.disruptor.AdmissionPipeline;
import fr.lapetina.tenantserving.disruptor.exception.BackpressureException;
import fr.lapetina.tenantserving.domain.clock.Clock;
import fr.lapetina.tenantserving.domain.clock.SystemClock;
import fr.lapetina.tenantserving.domain.limit.TokenBucketLimiter;
import fr.lapetina.tenantserving.domain.model.AdmissionOutcome;
import fr.lapetina.tenantserving.domain.model.AdmissionRequest;
import fr.lapetina.tenantserving.domain.model.PoolCapacity;
import fr.lapetina.tenantserving.domain.model.PoolLease;
import fr.lapetina.tenantserving.domain.model.TenantPolicy;
import fr.lapetina.tenantserving.domain.tenant.TenantRegistry;
import fr.lapetina.tenantserving.domain.tenant.TenantState;
import fr.lapetina.tenantserving.infrastructure.config.ServingConfig;
import fr.lapetina.tenantserving.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.tenantserving.infrastructure.pool.ResourcePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the admission layer.
 *
 * {@link #submit} publishes the request into the ingress pipeline and returns at once with a
 * {@link RequestHandle}; the decision arrives on the handle's outcome future. Dispatched
 * requests hold a {@link PoolLease} until {@link #complete(PoolLease)} is called, either by
 * the caller or by the controller itself when the {@link RequestBackend} finishes.
 *
 * <pre>
 * AdmissionController controller = AdmissionController.builder()
 *         .registry(registry)
 *         .pool(new SlotResourcePool(8))
 *         .build();
 * controller.start();
 * RequestHandle handle = controller.submit("tenant-a");
 * AdmissionOutcome outcome = handle.outcome().join();
 * </pre>
 */
public final class AdmissionController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final TenantRegistry registry;
    private final ResourcePool pool;
    private final Clock clock;
    private final MetricsRegistry metrics;
    private final TokenBucketLimiter limiter;
    private final Dispatcher dispatcher;
    private final DispatchLoop loop;
    private final AdmissionPipeline pipeline;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private AdmissionController(Builder builder) {
        this.registry = builder.registry;
        this.pool = builder.pool;
        this.clock = builder.clock;
        this.metrics = builder.metrics;
        this.limiter = new TokenBucketLimiter(registry, clock);
        this.dispatcher = new Dispatcher(registry, limiter, pool, builder.backend, clock, metrics);
        this.loop = new DispatchLoop(dispatcher::drain, builder.sweepInterval);
        dispatcher.onWakeUp(loop::signal);

        this.pipeline = AdmissionPipeline.builder()
                .ringBufferSize(builder.ringBufferSize)
                .waitStrategy(builder.waitStrategy)
                .strictRegistration(builder.strictRegistration)
                .registry(registry)
                .limiter(limiter)
                .dispatcher(dispatcher)
                .metricsRegistry(metrics)
                .clock(clock)
                .build();

        registerGauges();
    }

    private void registerGauges() {
        metrics.registerQueueDepth(dispatcher::queueSize);
        metrics.registerPoolCapacity(() -> pool.capacity().used(), () -> pool.capacity().total());
        metrics.registerRingBufferRemaining(pipeline::getRemainingCapacity);

        registry.addListener(event -> registerTenantGauge(event.tenantId()));
        for (TenantState state : registry.states()) {
            registerTenantGauge(state.getTenantId());
        }
    }

    private void registerTenantGauge(String tenantId) {
        TenantState state = registry.stateOf(tenantId);
        metrics.registerTenantInFlight(tenantId, state::getInFlight);
    }

    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Admission controller is closed");
        }
        if (running.compareAndSet(false, true)) {
            pipeline.start();
            loop.start();
            log.info("AdmissionController started: pool={}, capacity={}, strictRegistration={}",
                    pool.getName(), pool.capacity(), pipeline.isStrictRegistration());
        }
    }

    public RequestHandle submit(String tenantId) {
        return submit(tenantId, AdmissionRequest.DEFAULT_COST, null);
    }

    public RequestHandle submit(String tenantId, double cost) {
        return submit(tenantId, cost, null);
    }

    /**
     * Submits a request for admission. Never blocks.
     *
     * @param tenantId tenant the request is charged to
     * @param cost     logical cost, positive and finite
     * @param deadline optional bound on queueing time, tighter than the tenant's max wait; may be null
     * @return the handle whose outcome completes with the admission decision
     * @throws BackpressureException if the ingress ring buffer is full
     * @throws IllegalStateException if the controller is not running
     */
    public RequestHandle submit(String tenantId, double cost, Duration deadline) {
        AdmissionRequest request = new AdmissionRequest(null, tenantId, cost, clock.nowNanos(), deadline);
        RequestHandle handle = new RequestHandle(request, dispatcher::cancel);
        handle.outcome().whenComplete((outcome, error) -> onOutcome(handle, outcome, error));

        pipeline.publish(handle);
        return handle;
    }

    private void onOutcome(RequestHandle handle, AdmissionOutcome outcome, Throwable error) {
        if (error != null) {
            log.error("Admission failed: requestId={}, tenantId={}", handle.requestId(), handle.tenantId(), error);
            return;
        }
        metrics.recordAdmission(outcome.tenantId(), outcome.status());
        if (outcome.isRejected()) {
            registry.stateOf(outcome.tenantId()).recordRejected();
            log.debug("Request rejected: requestId={}, tenantId={}, status={}, message={}",
                    outcome.requestId(), outcome.tenantId(), outcome.status(), outcome.message());
        }
    }

    /**
     * Releases a dispatched request's lease.
     *
     * @return false when the lease is unknown or was already completed; never throws
     */
    public boolean complete(PoolLease lease) {
        Objects.requireNonNull(lease, "Lease is required");
        return dispatcher.complete(lease);
    }

    /**
     * Cancels a request that has not been dispatched yet.
     *
     * @return true if this call cancelled it
     */
    public boolean cancel(RequestHandle handle) {
        return dispatcher.cancel(handle);
    }

    /**
     * Sets a tenant's policy. Queued requests keep the policy they were admitted with.
     */
    public void setPolicy(String tenantId, TenantPolicy policy) {
        registry.update(tenantId, policy);
    }

    public TenantPolicy getPolicy(String tenantId) {
        return registry.lookup(tenantId);
    }

    public void setStrictRegistration(boolean strictRegistration) {
        pipeline.setStrictRegistration(strictRegistration);
    }

    public TenantRegistry getRegistry() {
        return registry;
    }

    public ResourcePool getPool() {
        return pool;
    }

    public PoolCapacity poolCapacity() {
        return pool.capacity();
    }

    public int queueSize() {
        return dispatcher.queueSize();
    }

    public int queueSize(String tenantId) {
        return dispatcher.queueSize(tenantId);
    }

    public int inFlight(String tenantId) {
        return registry.stateOf(tenantId).getInFlight();
    }

    public int activeLeaseCount() {
        return dispatcher.activeLeaseCount();
    }

    public long getRemainingCapacity() {
        return pipeline.getRemainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops ingress, lets published requests finish their admission, stops the dispatch
     * loop and rejects every still-queued request with POOL_UNAVAILABLE.
     * Leases already dispatched stay valid and can still be completed.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        log.info("Shutting down AdmissionController...");
        pipeline.close();
        loop.close();
        dispatcher.close();
        log.info("AdmissionController shut down: activeLeases={}", dispatcher.activeLeaseCount());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for AdmissionController.
     */
    public static final class Builder {
        private TenantRegistry registry;
        private ResourcePool pool;
        private RequestBackend backend = RequestBackend.callerManaged();
        private Clock clock = SystemClock.instance();
        private MetricsRegistry metrics;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private Duration sweepInterval = Duration.ofMillis(50);
        private boolean strictRegistration;

        public Builder registry(TenantRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder pool(ResourcePool pool) {
            this.pool = pool;
            return this;
        }

        public Builder backend(RequestBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder ringBufferSize(int ringBufferSize) {
            this.ringBufferSize = ringBufferSize;
            return this;
        }

        public Builder waitStrategy(String waitStrategy) {
            this.waitStrategy = waitStrategy;
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            if (sweepInterval.isNegative() || sweepInterval.isZero()) {
                throw new IllegalArgumentException("Sweep interval must be > 0, got " + sweepInterval);
            }
            this.sweepInterval = sweepInterval;
            return this;
        }

        public Builder strictRegistration(boolean strictRegistration) {
            this.strictRegistration = strictRegistration;
            return this;
        }

        public Builder fromConfig(ServingConfig config) {
            ServingConfig.AdmissionConfig admission = config.getAdmission();
            this.ringBufferSize = admission.getRingBufferSize();
            this.waitStrategy = admission.getWaitStrategy();
            sweepInterval(Duration.ofMillis(admission.getSweepIntervalMs()));
            this.strictRegistration = admission.isStrictRegistration();
            return this;
        }

        public AdmissionController build() {
            if (registry == null) {
                throw new IllegalStateException("TenantRegistry is required");
            }
            if (pool == null) {
                throw new IllegalStateException("ResourcePool is required");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            if (metrics == null) {
                metrics = new MetricsRegistry();
            }
            return new AdmissionController(this);
        }
    }
}
