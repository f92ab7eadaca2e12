package fr.lapetina.tenantserving.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.tenantserving.admission.RequestHandle;
import fr.lapetina.tenantserving.domain.event.AdmissionEvent;
import fr.lapetina.tenantserving.domain.event.EventState;
import fr.lapetina.tenantserving.domain.model.AdmissionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final stage handler: delivers rejections and recycles the event.
 *
 * Dispatched requests were completed by the dispatcher and queued ones will be completed
 * by the dispatch loop; only rejections decided in the pipeline are completed here.
 */
public final class CompletionHandler implements EventHandler<AdmissionEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(AdmissionEvent event, long sequence, boolean endOfBatch) {
        try {
            RequestHandle handle = event.getHandle();
            if (handle == null || event.getState() != EventState.REJECTED) {
                return;
            }

            boolean delivered = handle.complete(AdmissionOutcome.rejected(
                    handle.request(), event.getRejection(), event.getRejectionMessage()));
            if (!delivered) {
                log.debug("Rejection not delivered, request already terminal: requestId={}, state={}",
                        handle.requestId(), handle.state());
            }
        } finally {
            // Clear event for reuse
            event.clear();
        }
    }
}
