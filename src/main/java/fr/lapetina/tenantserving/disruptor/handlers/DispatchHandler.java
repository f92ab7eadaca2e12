package fr.lapetina.tenantserving.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.tenantserving.admission.Dispatcher;
import fr.lapetina.tenantserving.domain.clock.Clock;
import fr.lapetina.tenantserving.domain.event.AdmissionEvent;
import fr.lapetina.tenantserving.domain.event.EventState;
import fr.lapetina.tenantserving.domain.model.AdmissionRequest;
import fr.lapetina.tenantserving.domain.model.OutcomeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fourth stage handler: dispatches the request or queues it.
 *
 * The lease, the in-flight reservation and the backend call are all handled by the
 * {@link Dispatcher}; this stage records the decision on the event.
 */
public final class DispatchHandler implements EventHandler<AdmissionEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final Dispatcher dispatcher;
    private final Clock clock;

    public DispatchHandler(Dispatcher dispatcher, Clock clock) {
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Override
    public void onEvent(AdmissionEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            return;
        }

        if (event.getState() != EventState.RATE_CHECKED) {
            throw new IllegalStateException("Invalid state for dispatch: " + event);
        }

        AdmissionRequest request = event.getRequest();
        Dispatcher.Admission admission = dispatcher.admit(event.getHandle(), event.getPolicy(), event.isRateOwed());
        long now = clock.nowNanos();

        switch (admission) {
            case DISPATCHED -> event.markDispatched(now);
            case QUEUED -> event.markQueued(now);
            case CANCELLED -> event.markCancelled(now);
            case QUOTA_EXCEEDED -> event.reject(OutcomeStatus.QUOTA_EXCEEDED,
                    "Tenant " + request.tenantId() + " reached its quota of "
                            + event.getPolicy().maxConcurrent() + " requests in flight",
                    now);
            case POOL_UNAVAILABLE -> event.reject(OutcomeStatus.POOL_UNAVAILABLE,
                    "Resource pool is closed or unhealthy", now);
        }

        log.debug("Admission decided: requestId={}, tenantId={}, admission={}",
                request.requestId(), request.tenantId(), admission);
    }
}
