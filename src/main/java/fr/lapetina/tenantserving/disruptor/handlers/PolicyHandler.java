package fr.lapetina.tenantserving.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.tenantserving.domain.clock.Clock;
import fr.lapetina.tenantserving.domain.event.AdmissionEvent;
import fr.lapetina.tenantserving.domain.model.AdmissionRequest;
import fr.lapetina.tenantserving.domain.model.OutcomeStatus;
import fr.lapetina.tenantserving.domain.model.TenantPolicy;
import fr.lapetina.tenantserving.domain.tenant.TenantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: resolves the tenant's policy.
 *
 * Unknown tenants get the default policy, unless strict registration is on, in which case
 * they are rejected with UNKNOWN_TENANT. The resolved policy is a snapshot: every later
 * stage, and the queue entry if the request waits, uses this same policy.
 */
public final class PolicyHandler implements EventHandler<AdmissionEvent> {

    private static final Logger log = LoggerFactory.getLogger(PolicyHandler.class);

    private final TenantRegistry registry;
    private final Clock clock;
    private volatile boolean strictRegistration;

    public PolicyHandler(TenantRegistry registry, Clock clock, boolean strictRegistration) {
        this.registry = registry;
        this.clock = clock;
        this.strictRegistration = strictRegistration;
    }

    @Override
    public void onEvent(AdmissionEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            log.debug("Skipping already processed event: sequence={}", sequence);
            return;
        }

        event.setSequence(sequence);
        AdmissionRequest request = event.getRequest();
        String tenantId = request.tenantId();

        if (strictRegistration && !registry.isRegistered(tenantId)) {
            event.reject(OutcomeStatus.UNKNOWN_TENANT, "Tenant not registered: " + tenantId, clock.nowNanos());
            log.warn("Unknown tenant rejected: requestId={}, tenantId={}", request.requestId(), tenantId);
            return;
        }

        TenantPolicy policy = registry.lookup(tenantId);
        registry.stateOf(tenantId);
        event.markPolicyResolved(policy, clock.nowNanos());

        log.debug("Policy resolved: requestId={}, tenantId={}, registered={}, policy={}",
                request.requestId(), tenantId, registry.isRegistered(tenantId), policy);
    }

    public void setStrictRegistration(boolean strictRegistration) {
        if (this.strictRegistration != strictRegistration) {
            log.info("Strict registration changed: {} -> {}", this.strictRegistration, strictRegistration);
        }
        this.strictRegistration = strictRegistration;
    }

    public boolean isStrictRegistration() {
        return strictRegistration;
    }
}
