package fr.lapetina.tenantserving.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.tenantserving.domain.event.AdmissionEvent;
import fr.lapetina.tenantserving.domain.event.EventState;
import fr.lapetina.tenantserving.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Fifth stage handler: records stage latencies and logs the decision.
 *
 * Sets MDC context (requestId, tenantId, requestState) for structured logging while it runs.
 * Outcome counters are recorded when the handle completes, since queued requests are only
 * decided later by the dispatch loop.
 */
public final class MetricsHandler implements EventHandler<AdmissionEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(AdmissionEvent event, long sequence, boolean endOfBatch) {
        if (event.getHandle() == null) {
            return;
        }

        setupMDC(event);

        try {
            recordMetrics(event);
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(AdmissionEvent event) {
        MDC.put("requestId", event.getHandle().requestId());
        MDC.put("tenantId", event.getHandle().tenantId());
        MDC.put("requestState", event.getState() != null ? event.getState().name() : "UNKNOWN");
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("tenantId");
        MDC.remove("requestState");
    }

    private void recordMetrics(AdmissionEvent event) {
        recordStage("policy", event.getAcceptedAtNanos(), event.getPolicyResolvedAtNanos());
        recordStage("quota", event.getPolicyResolvedAtNanos(), event.getQuotaCheckedAtNanos());
        recordStage("rate", event.getQuotaCheckedAtNanos(), event.getRateCheckedAtNanos());
        recordStage("dispatch", event.getRateCheckedAtNanos(), event.getDecidedAtNanos());
        recordStage("total", event.getAcceptedAtNanos(), event.getDecidedAtNanos());

        EventState state = event.getState();
        if (state == EventState.REJECTED) {
            log.warn("Admission rejected: status={}, message={}",
                    event.getRejection(), event.getRejectionMessage());
        } else if (!event.isDecided() && event.getHandle().isDone()) {
            log.debug("Request cancelled before a decision: state={}", state);
        } else {
            log.debug("Admission decision: state={}", state);
        }
    }

    private void recordStage(String stage, long startNanos, long endNanos) {
        if (startNanos == AdmissionEvent.UNSET || endNanos == AdmissionEvent.UNSET) {
            return;
        }
        metricsRegistry.recordStageLatency(stage, Duration.ofNanos(Math.max(0, endNanos - startNanos)));
    }
}
