package fr.lapetina.tenantserving.infrastructure.pool;

import fr.lapetina.tenantserving.domain.model.PoolCapacity;
import fr.lapetina.tenantserving.domain.model.PoolLease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed number of interchangeable slots.
 *
 * The used counter is reserved by CAS before a slot index is taken from the free list,
 * and a slot index is returned to the free list before the counter is decremented, so a
 * successful reservation always finds a free index.
 */
public final class SlotResourcePool implements ResourcePool {

    private static final Logger log = LoggerFactory.getLogger(SlotResourcePool.class);

    private final String name;
    private final int capacity;
    private final AtomicInteger used = new AtomicInteger(0);
    private final ConcurrentLinkedQueue<Integer> freeSlots = new ConcurrentLinkedQueue<>();
    private final Map<String, HeldSlot> outstanding = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public SlotResourcePool(int capacity) {
        this("slots", capacity);
    }

    public SlotResourcePool(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Pool capacity must be >= 1, got " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        for (int i = 0; i < capacity; i++) {
            freeSlots.add(i);
        }
        log.info("SlotResourcePool created: name={}, capacity={}", name, capacity);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Optional<PoolLease> tryAcquire(String tenantId, String requestId) {
        if (closed) {
            return Optional.empty();
        }
        while (true) {
            int current = used.get();
            if (current >= capacity) {
                return Optional.empty();
            }
            if (used.compareAndSet(current, current + 1)) {
                break;
            }
        }

        Integer slot = freeSlots.poll();
        if (slot == null) {
            used.decrementAndGet();
            throw new LeaseAccountingException("none", "slot counter reserved but no free slot in pool " + name);
        }

        PoolLease lease = new PoolLease(
                UUID.randomUUID().toString(),
                name + "-" + slot,
                tenantId,
                requestId,
                Instant.now()
        );
        outstanding.put(lease.leaseId(), new HeldSlot(lease, slot));

        log.debug("Slot acquired: pool={}, slot={}, tenantId={}, requestId={}, used={}/{}",
                name, slot, tenantId, requestId, used.get(), capacity);
        return Optional.of(lease);
    }

    @Override
    public void release(PoolLease lease) {
        HeldSlot held = outstanding.get(lease.leaseId());
        if (held == null || !held.lease().equals(lease)) {
            throw new LeaseAccountingException(lease.leaseId(), "unknown or already released lease in pool " + name);
        }
        if (!outstanding.remove(lease.leaseId(), held)) {
            throw new LeaseAccountingException(lease.leaseId(), "lease released concurrently in pool " + name);
        }

        freeSlots.offer(held.slot());
        int remaining = used.decrementAndGet();
        if (remaining < 0) {
            throw new LeaseAccountingException(lease.leaseId(), "negative capacity in pool " + name);
        }

        log.debug("Slot released: pool={}, slot={}, tenantId={}, used={}/{}",
                name, held.slot(), lease.tenantId(), remaining, capacity);
    }

    @Override
    public PoolCapacity capacity() {
        return new PoolCapacity(used.get(), capacity);
    }

    @Override
    public boolean isAvailable() {
        return !closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.info("SlotResourcePool closed: name={}, outstandingLeases={}", name, outstanding.size());
        }
    }

    private record HeldSlot(PoolLease lease, int slot) {
    }
}
