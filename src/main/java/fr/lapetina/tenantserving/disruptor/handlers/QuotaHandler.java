package fr.lapetina.tenantserving.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.tenantserving.domain.clock.Clock;
import fr.lapetina.tenantserving.domain.event.AdmissionEvent;
import fr.lapetina.tenantserving.domain.event.EventState;
import fr.lapetina.tenantserving.domain.model.AdmissionRequest;
import fr.lapetina.tenantserving.domain.model.OutcomeStatus;
import fr.lapetina.tenantserving.domain.tenant.TenantRegistry;
import fr.lapetina.tenantserving.domain.tenant.TenantState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second stage handler: enforces the tenant's in-flight quota.
 *
 * A tenant already at its quota is rejected immediately with QUOTA_EXCEEDED. Such a
 * request never touches the token bucket or the queue.
 */
public final class QuotaHandler implements EventHandler<AdmissionEvent> {

    private static final Logger log = LoggerFactory.getLogger(QuotaHandler.class);

    private final TenantRegistry registry;
    private final Clock clock;

    public QuotaHandler(TenantRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public void onEvent(AdmissionEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.POLICY_RESOLVED) {
            return;
        }

        AdmissionRequest request = event.getRequest();
        TenantState state = registry.stateOf(request.tenantId());
        int inFlight = state.getInFlight();
        int quota = event.getPolicy().maxConcurrent();

        if (inFlight >= quota) {
            event.reject(OutcomeStatus.QUOTA_EXCEEDED,
                    "Tenant " + request.tenantId() + " has " + inFlight + "/" + quota + " requests in flight",
                    clock.nowNanos());
            log.warn("Quota exceeded: requestId={}, tenantId={}, inFlight={}, quota={}",
                    request.requestId(), request.tenantId(), inFlight, quota);
            return;
        }

        event.markQuotaChecked(clock.nowNanos());
    }
}
