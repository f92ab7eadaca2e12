package fr.lapetina.tenantserving.domain.tenant;

import fr.lapetina.tenantserving.domain.limit.TokenBucket;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runtime state of one tenant: in-flight counter, token bucket and admission counters.
 * Thread-safe; each tenant's state is updated independently of every other tenant.
 */
public final class TenantState {

    private final String tenantId;
    private final TokenBucket bucket = new TokenBucket();
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicLong dispatched = new AtomicLong(0);
    private final AtomicLong rejected = new AtomicLong(0);

    TenantState(String tenantId) {
        this.tenantId = Objects.requireNonNull(tenantId, "Tenant ID is required");
    }

    public String getTenantId() {
        return tenantId;
    }

    public TokenBucket getBucket() {
        return bucket;
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * Attempts to reserve one in-flight unit without exceeding {@code quota}.
     * @return true if reserved, false if the tenant is at its quota
     */
    public boolean tryReserve(int quota) {
        while (true) {
            int current = inFlight.get();
            if (current >= quota) {
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Releases one in-flight unit.
     * @return false if the counter was already zero, which means a release without a reservation
     */
    public boolean release() {
        while (true) {
            int current = inFlight.get();
            if (current <= 0) {
                return false;
            }
            if (inFlight.compareAndSet(current, current - 1)) {
                return true;
            }
        }
    }

    public void recordDispatched() {
        dispatched.incrementAndGet();
    }

    public void recordRejected() {
        rejected.incrementAndGet();
    }

    public long getDispatchedCount() {
        return dispatched.get();
    }

    public long getRejectedCount() {
        return rejected.get();
    }

    @Override
    public String toString() {
        return "TenantState{" +
                "tenantId='" + tenantId + '\'' +
                ", inFlight=" + inFlight.get() +
                ", dispatched=" + dispatched.get() +
                ", rejected=" + rejected.get() +
                '}';
    }
}
