package fr.lapetina.tenantserving.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating AdmissionEvent instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates events at startup; they are then reused by clearing
 * and re-initializing them.
 */
public final class AdmissionEventFactory implements EventFactory<AdmissionEvent> {

    @Override
    public AdmissionEvent newInstance() {
        return new AdmissionEvent();
    }
}
