package fr.lapetina.tenantserving.infrastructure.metrics;

import fr.lapetina.tenantserving.domain.model.OutcomeStatus;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Admission outcome counters per tenant
 * - Queue wait and pipeline stage timers
 * - Queue depth, pool occupancy and per-tenant in-flight gauges
 * - Lease accounting violation counter
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "tenant_serving";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> admissionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> queueWaitTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final Set<String> tenantGauges = ConcurrentHashMap.newKeySet();

    private final Counter leaseViolations;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.leaseViolations = Counter.builder(prefix + "_lease_violations_total")
                .description("Lease releases that broke pool accounting (unknown or double release)")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Counts one terminal admission outcome for a tenant.
     */
    public void recordAdmission(String tenantId, OutcomeStatus status) {
        String key = tenantId + ":" + status.name();
        admissionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_admissions_total")
                        .description("Admission outcomes per tenant")
                        .tag("tenant", tenantId)
                        .tag("outcome", status.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records how long a dispatched request waited in the fair queue.
     */
    public void recordQueueWait(String tenantId, Duration wait) {
        queueWaitTimers.computeIfAbsent(tenantId, k ->
                Timer.builder(prefix + "_queue_wait")
                        .description("Time spent in the fair queue before dispatch")
                        .tag("tenant", tenantId)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(wait);
    }

    /**
     * Records stage-specific latency (policy, quota, rate, dispatch).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Admission pipeline stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    public void incrementLeaseViolations() {
        leaseViolations.increment();
    }

    public double getLeaseViolations() {
        return leaseViolations.count();
    }

    public void registerQueueDepth(Supplier<Number> depth) {
        Gauge.builder(prefix + "_queue_depth", depth, s -> s.get().doubleValue())
                .description("Requests waiting in the fair queue")
                .strongReference(true)
                .register(registry);
    }

    public void registerPoolCapacity(Supplier<Number> used, Supplier<Number> total) {
        Gauge.builder(prefix + "_pool_used", used, s -> s.get().doubleValue())
                .description("Pool capacity units currently leased")
                .strongReference(true)
                .register(registry);
        Gauge.builder(prefix + "_pool_total", total, s -> s.get().doubleValue())
                .description("Pool capacity units currently offered")
                .strongReference(true)
                .register(registry);
    }

    public void registerRingBufferRemaining(Supplier<Number> remaining) {
        Gauge.builder(prefix + "_ringbuffer_remaining", remaining, s -> s.get().doubleValue())
                .description("Remaining capacity in the ingress ring buffer")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Registers the in-flight gauge of a tenant, once per tenant.
     */
    public void registerTenantInFlight(String tenantId, Supplier<Number> inFlight) {
        if (!tenantGauges.add(tenantId)) {
            return;
        }
        Gauge.builder(prefix + "_tenant_inflight", inFlight, s -> s.get().doubleValue())
                .description("Dispatched requests in flight per tenant")
                .tag("tenant", tenantId)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
