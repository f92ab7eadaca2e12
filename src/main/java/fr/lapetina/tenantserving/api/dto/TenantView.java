package fr.lapetina.tenantserving.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.tenantserving.domain.model.TenantPolicy;

/**
 * A tenant as returned by the admin endpoints.
 * An unlimited rate is rendered as a {@code null} ratePerSecond.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record TenantView(
        String id,
        boolean registered,
        int weight,
        int maxConcurrent,
        Double ratePerSecond,
        double burst,
        long maxWaitMs,
        boolean queueOnRateLimit,
        int inFlight,
        int queued,
        long dispatched,
        long rejected
) {

    public static TenantView of(
            String id,
            boolean registered,
            TenantPolicy policy,
            int inFlight,
            int queued,
            long dispatched,
            long rejected
    ) {
        return new TenantView(
                id,
                registered,
                policy.weight(),
                policy.maxConcurrent(),
                policy.isRateUnlimited() ? null : policy.ratePerSecond(),
                policy.burst(),
                policy.maxWait().toMillis(),
                policy.queueOnRateLimit(),
                inFlight,
                queued,
                dispatched,
                rejected
        );
    }
}
