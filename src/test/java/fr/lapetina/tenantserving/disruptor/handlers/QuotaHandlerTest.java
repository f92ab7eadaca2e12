package fr.lapetina.tenantserving.disruptor.handlers;

import fr.lapetina.tenantserving.admission.RequestHandle;
import fr.lapetina.tenantserving.domain.clock.ManualClock;
import fr.lapetina.tenantserving.domain.event.AdmissionEvent;
import fr.lapetina.tenantserving.domain.event.EventState;
import fr.lapetina.tenantserving.domain.model.AdmissionRequest;
import fr.lapetina.tenantserving.domain.model.OutcomeStatus;
import fr.lapetina.tenantserving.domain.model.TenantPolicy;
import fr.lapetina.tenantserving.domain.tenant.TenantRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QuotaHandlerTest {

    private TenantRegistry registry;
    private QuotaHandler handler;
    private AdmissionEvent event;
    private TenantPolicy policy;

    @BeforeEach
    void setUp() {
        ManualClock clock = new ManualClock();
        registry = new TenantRegistry();
        handler = new QuotaHandler(registry, clock);
        policy = TenantPolicy.builder().maxConcurrent(2).build();
        event = new AdmissionEvent();
        event.initialize(new RequestHandle(AdmissionRequest.of("tenant-a", 1.0, 0L), h -> false), 0L);
        event.markPolicyResolved(policy, 0L);
    }

    @Test
    @DisplayName("should pass requests under the quota")
    void shouldPassUnderQuota() {
        registry.stateOf("tenant-a").tryReserve(2);

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.QUOTA_CHECKED);
        // The check does not reserve anything
        assertThat(registry.stateOf("tenant-a").getInFlight()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reject requests at the quota")
    void shouldRejectAtQuota() {
        registry.stateOf("tenant-a").tryReserve(2);
        registry.stateOf("tenant-a").tryReserve(2);

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.REJECTED);
        assertThat(event.getRejection()).isEqualTo(OutcomeStatus.QUOTA_EXCEEDED);
        assertThat(event.getRejectionMessage()).contains("2/2");
    }

    @Test
    @DisplayName("should ignore events already rejected")
    void shouldIgnoreRejected() {
        event.reject(OutcomeStatus.UNKNOWN_TENANT, "unknown", 0L);

        handler.onEvent(event, 0, true);

        assertThat(event.getRejection()).isEqualTo(OutcomeStatus.UNKNOWN_TENANT);
    }
}
