package fr.lapetina.tenantserving.domain.limit;

import fr.lapetina.tenantserving.domain.clock.Clock;
import fr.lapetina.tenantserving.domain.model.TenantPolicy;
import fr.lapetina.tenantserving.domain.tenant.TenantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Per-tenant rate and burst control.
 *
 * Each tenant owns one {@link TokenBucket} held by its runtime record in the
 * {@link TenantRegistry}. Unlimited-rate policies bypass the bucket.
 */
public final class TokenBucketLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketLimiter.class);

    private final TenantRegistry registry;
    private final Clock clock;

    public TokenBucketLimiter(TenantRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "TenantRegistry is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    /**
     * Tries to charge {@code cost} tokens to the tenant, using the tenant's current policy.
     */
    public boolean tryConsume(String tenantId, double cost) {
        return tryConsume(tenantId, registry.lookup(tenantId), cost);
    }

    /**
     * Tries to charge {@code cost} tokens to the tenant under an already resolved policy.
     *
     * @return true if the tokens were taken; false leaves the bucket balance unchanged
     */
    public boolean tryConsume(String tenantId, TenantPolicy policy, double cost) {
        if (policy.isRateUnlimited()) {
            return true;
        }
        boolean consumed = registry.stateOf(tenantId).getBucket()
                .tryConsume(policy.ratePerSecond(), policy.burst(), cost, clock.nowNanos());
        if (!consumed) {
            log.debug("Token bucket empty: tenantId={}, cost={}, ratePerSecond={}, burst={}",
                    tenantId, cost, policy.ratePerSecond(), policy.burst());
        }
        return consumed;
    }

    /**
     * Nanoseconds until {@code cost} tokens are available: 0 when they already are,
     * {@link Long#MAX_VALUE} when the cost exceeds the burst.
     */
    public long nanosUntilAvailable(String tenantId, TenantPolicy policy, double cost) {
        if (policy.isRateUnlimited()) {
            return 0L;
        }
        return registry.stateOf(tenantId).getBucket()
                .nanosUntilAvailable(policy.ratePerSecond(), policy.burst(), cost, clock.nowNanos());
    }

    /**
     * Current token balance of the tenant; infinite for unlimited-rate tenants.
     */
    public double available(String tenantId, TenantPolicy policy) {
        if (policy.isRateUnlimited()) {
            return Double.POSITIVE_INFINITY;
        }
        return registry.stateOf(tenantId).getBucket()
                .available(policy.ratePerSecond(), policy.burst(), clock.nowNanos());
    }
}
