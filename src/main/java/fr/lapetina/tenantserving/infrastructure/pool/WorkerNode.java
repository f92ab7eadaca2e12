package fr.lapetina.tenantserving.infrastructure.pool;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A worker node contributing capacity to a {@link NodeResourcePool}.
 * Thread-safe for concurrent access from admission and completion paths.
 */
public final class WorkerNode {
    private final String id;
    private final int maxConcurrent;
    private final int weight;
    private final boolean enabled;

    // Mutable state - thread-safe
    private final AtomicReference<NodeHealth> health;
    private final AtomicInteger inFlight;
    private volatile long lastHealthChange;

    private WorkerNode(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node ID is required");
        if (builder.maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, got " + builder.maxConcurrent);
        }
        if (builder.weight < 1) {
            throw new IllegalArgumentException("weight must be >= 1, got " + builder.weight);
        }
        this.maxConcurrent = builder.maxConcurrent;
        this.weight = builder.weight;
        this.enabled = builder.enabled;
        this.health = new AtomicReference<>(builder.initialHealth);
        this.inFlight = new AtomicInteger(0);
        this.lastHealthChange = System.currentTimeMillis();
    }

    public String getId() {
        return id;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public int getWeight() {
        return weight;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public NodeHealth getHealth() {
        return health.get();
    }

    /**
     * Sets the health and returns the previous value.
     */
    public NodeHealth setHealth(NodeHealth newHealth) {
        NodeHealth previous = health.getAndSet(Objects.requireNonNull(newHealth));
        if (previous != newHealth) {
            this.lastHealthChange = System.currentTimeMillis();
        }
        return previous;
    }

    public long getLastHealthChange() {
        return lastHealthChange;
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * In-flight leases per unit of weight; lower means less loaded.
     */
    public double getLoadRatio() {
        return (double) inFlight.get() / weight;
    }

    /**
     * Attempts to acquire a slot.
     * @return true if slot acquired, false if at capacity
     */
    public boolean tryAcquireSlot() {
        while (true) {
            int current = inFlight.get();
            if (current >= maxConcurrent) {
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Releases a slot.
     * @return false if no slot was held, in which case nothing changes
     */
    public boolean releaseSlot() {
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

    /**
     * Whether the node can take leases at all: enabled and not DOWN.
     */
    public boolean isActive() {
        return enabled && health.get() != NodeHealth.DOWN;
    }

    /**
     * Checks if node can take a lease now: active and below its limit.
     */
    public boolean isAvailable() {
        return isActive() && inFlight.get() < maxConcurrent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerNode that = (WorkerNode) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkerNode{" +
                "id='" + id + '\'' +
                ", weight=" + weight +
                ", health=" + health.get() +
                ", inFlight=" + inFlight.get() +
                "/" + maxConcurrent +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private int maxConcurrent = 10;
        private int weight = 1;
        private boolean enabled = true;
        private NodeHealth initialHealth = NodeHealth.UP;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder maxConcurrent(int max) {
            this.maxConcurrent = max;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder initialHealth(NodeHealth health) {
            this.initialHealth = health;
            return this;
        }

        public WorkerNode build() {
            return new WorkerNode(this);
        }
    }
}
