package fr.lapetina.tenantserving.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.tenantserving.domain.clock.Clock;
import fr.lapetina.tenantserving.domain.event.AdmissionEvent;
import fr.lapetina.tenantserving.domain.event.EventState;
import fr.lapetina.tenantserving.domain.limit.TokenBucketLimiter;
import fr.lapetina.tenantserving.domain.model.AdmissionRequest;
import fr.lapetina.tenantserving.domain.model.OutcomeStatus;
import fr.lapetina.tenantserving.domain.model.TenantPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Third stage handler: charges the tenant's token bucket.
 *
 * When the bucket cannot pay, the request is rejected with RATE_LIMITED, unless the
 * policy queues on rate limit: the request then goes to the queue with its cost still
 * owed, and the dispatch loop charges the bucket before dispatching it.
 */
public final class RateLimitHandler implements EventHandler<AdmissionEvent> {

    private static final Logger log = LoggerFactory.getLogger(RateLimitHandler.class);

    private final TokenBucketLimiter limiter;
    private final Clock clock;

    public RateLimitHandler(TokenBucketLimiter limiter, Clock clock) {
        this.limiter = limiter;
        this.clock = clock;
    }

    @Override
    public void onEvent(AdmissionEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.QUOTA_CHECKED) {
            return;
        }

        AdmissionRequest request = event.getRequest();
        TenantPolicy policy = event.getPolicy();

        if (limiter.tryConsume(request.tenantId(), policy, request.cost())) {
            event.markRateChecked(false, clock.nowNanos());
            return;
        }

        if (policy.queueOnRateLimit()) {
            event.markRateChecked(true, clock.nowNanos());
            log.info("Rate limited, queueing with cost owed: requestId={}, tenantId={}, cost={}",
                    request.requestId(), request.tenantId(), request.cost());
            return;
        }

        long waitNanos = limiter.nanosUntilAvailable(request.tenantId(), policy, request.cost());
        String retry = waitNanos == Long.MAX_VALUE
                ? "cost exceeds burst " + policy.burst()
                : "retry in " + TimeUnit.NANOSECONDS.toMillis(waitNanos) + " ms";
        event.reject(OutcomeStatus.RATE_LIMITED,
                "Tenant " + request.tenantId() + " rate limited, " + retry,
                clock.nowNanos());

        log.warn("Rate limited: requestId={}, tenantId={}, cost={}, ratePerSecond={}, burst={}",
                request.requestId(), request.tenantId(), request.cost(), policy.ratePerSecond(), policy.burst());
    }
}
