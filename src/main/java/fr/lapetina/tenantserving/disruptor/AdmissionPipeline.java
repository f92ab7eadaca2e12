package fr.lapetina.tenantserving.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.tenantserving.admission.Dispatcher;
import fr.lapetina.tenantserving.admission.RequestHandle;
import fr.lapetina.tenantserving.disruptor.exception.BackpressureException;
import fr.lapetina.tenantserving.disruptor.handlers.*;
import fr.lapetina.tenantserving.domain.clock.Clock;
import fr.lapetina.tenantserving.domain.event.AdmissionEvent;
import fr.lapetina.tenantserving.domain.event.AdmissionEventFactory;
import fr.lapetina.tenantserving.domain.limit.TokenBucketLimiter;
import fr.lapetina.tenantserving.domain.tenant.TenantRegistry;
import fr.lapetina.tenantserving.infrastructure.config.ServingConfig;
import fr.lapetina.tenantserving.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ingress pipeline: every submitted request passes through the ring buffer and the
 * admission stages in order.
 *
 * <pre>
 * Policy -> Quota -> Rate limit -> Dispatch -> Metrics -> Completion
 * </pre>
 *
 * Publishing never blocks: when the ring buffer is full the caller gets a
 * {@link BackpressureException} at once.
 *
 * PRODUCER TYPE: MULTI, requests are submitted from many caller threads concurrently.
 *
 * WAIT STRATEGY: configurable, default blocking. Yielding and busy-spin lower latency
 * at the cost of one busy core per stage.
 */
public final class AdmissionPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdmissionPipeline.class);

    private final Disruptor<AdmissionEvent> disruptor;
    private final RingBuffer<AdmissionEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Clock clock;

    private final PolicyHandler policyHandler;

    private AdmissionPipeline(Builder builder) {
        this.clock = builder.clock;

        ThreadFactory threadFactory = new DisruptorThreadFactory("admission-stage");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new AdmissionEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        this.policyHandler = new PolicyHandler(builder.registry, clock, builder.strictRegistration);
        QuotaHandler quotaHandler = new QuotaHandler(builder.registry, clock);
        RateLimitHandler rateLimitHandler = new RateLimitHandler(builder.limiter, clock);
        DispatchHandler dispatchHandler = new DispatchHandler(builder.dispatcher, clock);
        MetricsHandler metricsHandler = new MetricsHandler(builder.metricsRegistry);
        CompletionHandler completionHandler = new CompletionHandler();

        // Each handler sees an event only after the previous one is done with it
        disruptor
                .handleEventsWith(policyHandler)
                .then(quotaHandler)
                .then(rateLimitHandler)
                .then(dispatchHandler)
                .then(metricsHandler)
                .then(completionHandler);

        disruptor.setDefaultExceptionHandler(new AdmissionExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("AdmissionPipeline created: ringBufferSize={}, waitStrategy={}, strictRegistration={}",
                builder.ringBufferSize, builder.waitStrategy, builder.strictRegistration);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("AdmissionPipeline started");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Publishes a request handle into the ring buffer.
     *
     * @throws BackpressureException if the ring buffer is full
     * @throws IllegalStateException if the pipeline is not running
     */
    public void publish(RequestHandle handle) {
        if (!running.get()) {
            throw new IllegalStateException("Admission pipeline not running");
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            log.warn("Ingress rejected, ring buffer full: requestId={}, tenantId={}",
                    handle.requestId(), handle.tenantId());
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    ringBuffer.getBufferSize()
            );
        }

        try {
            AdmissionEvent event = ringBuffer.get(sequence);
            event.initialize(handle, clock.nowNanos());
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Request published: requestId={}, tenantId={}, sequence={}",
                handle.requestId(), handle.tenantId(), sequence);
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public int getBufferSize() {
        return ringBuffer.getBufferSize();
    }

    public void setStrictRegistration(boolean strictRegistration) {
        policyHandler.setStrictRegistration(strictRegistration);
    }

    public boolean isStrictRegistration() {
        return policyHandler.isStrictRegistration();
    }

    /**
     * Stops accepting requests and processes the events already published.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down AdmissionPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("AdmissionPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("AdmissionPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for Disruptor consumer threads.
     */
    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor: fails the request's outcome and keeps the pipeline running.
     */
    private static class AdmissionExceptionHandler implements ExceptionHandler<AdmissionEvent> {

        private static final Logger log = LoggerFactory.getLogger(AdmissionExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, AdmissionEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            if (event.getHandle() != null) {
                event.getHandle().fail(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for AdmissionPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private boolean strictRegistration;
        private TenantRegistry registry;
        private TokenBucketLimiter limiter;
        private Dispatcher dispatcher;
        private MetricsRegistry metricsRegistry;
        private Clock clock;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (size < 1 || Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder strictRegistration(boolean strict) {
            this.strictRegistration = strict;
            return this;
        }

        public Builder registry(TenantRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder limiter(TokenBucketLimiter limiter) {
            this.limiter = limiter;
            return this;
        }

        public Builder dispatcher(Dispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder fromConfig(ServingConfig.AdmissionConfig config) {
            ringBufferSize(config.getRingBufferSize());
            this.waitStrategy = config.getWaitStrategy();
            this.strictRegistration = config.isStrictRegistration();
            return this;
        }

        public AdmissionPipeline build() {
            if (registry == null) {
                throw new IllegalStateException("TenantRegistry is required");
            }
            if (limiter == null) {
                throw new IllegalStateException("TokenBucketLimiter is required");
            }
            if (dispatcher == null) {
                throw new IllegalStateException("Dispatcher is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            return new AdmissionPipeline(this);
        }
    }
}
