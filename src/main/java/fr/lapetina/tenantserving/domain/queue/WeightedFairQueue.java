package fr.lapetina.tenantserving.domain.queue;

import fr.lapetina.tenantserving.domain.model.TenantPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Weighted fair queue across tenants, ordered by virtual finish time.
 *
 * On enqueue an entry gets {@code vft = max(tenant's last finish, global virtual time) + cost / weight}.
 * Entries are served smallest vft first, ties broken by arrival order then tenant ID, and
 * serving an entry advances the global virtual time to its vft. A tenant with pending work is
 * never skipped indefinitely, service shares converge to the weight ratios, and a single
 * tenant is served FIFO.
 *
 * Layout: one FIFO per tenant plus an ordered set holding only each tenant's head. Within a
 * tenant vft grows with arrival order, so the head of the FIFO is always that tenant's
 * smallest entry. Enqueue and dequeue are O(log tenants).
 *
 * Thread-safety: a single lock guards the structure and the virtual clock. Callers evaluate
 * admission policy outside it, using {@link #heads()} and {@link #take(FairQueueEntry)}.
 *
 * @param <T> the caller's payload
 */
public final class WeightedFairQueue<T> {

    private static final Logger log = LoggerFactory.getLogger(WeightedFairQueue.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ArrayDeque<FairQueueEntry<T>>> byTenant = new HashMap<>();
    private final TreeSet<FairQueueEntry<T>> heads = new TreeSet<>(FairQueueEntry.ORDER);
    private final Map<String, Double> lastFinish = new HashMap<>();

    private double virtualTime;
    private long nextSequence;
    private int size;

    /**
     * Enqueues a request and returns its entry.
     *
     * @param tenantId      tenant the entry belongs to
     * @param cost          logical cost, divided by the policy weight to advance the tenant's finish time
     * @param policy        policy snapshot kept with the entry
     * @param deadlineNanos absolute time after which the entry must not be dispatched
     * @param rateOwed      whether the token bucket still has to be charged before dispatch
     * @param payload       caller data
     */
    public FairQueueEntry<T> enqueue(
            String tenantId,
            double cost,
            TenantPolicy policy,
            long deadlineNanos,
            boolean rateOwed,
            T payload
    ) {
        lock.lock();
        try {
            double start = Math.max(lastFinish.getOrDefault(tenantId, 0d), virtualTime);
            double finish = start + cost / policy.weight();
            lastFinish.put(tenantId, finish);

            FairQueueEntry<T> entry = new FairQueueEntry<>(
                    payload, tenantId, cost, policy, deadlineNanos, rateOwed, finish, nextSequence++);

            ArrayDeque<FairQueueEntry<T>> fifo = byTenant.computeIfAbsent(tenantId, id -> new ArrayDeque<>());
            fifo.addLast(entry);
            if (fifo.size() == 1) {
                heads.add(entry);
            }
            size++;

            log.debug("Enqueued: tenantId={}, vft={}, seq={}, queueSize={}",
                    tenantId, finish, entry.getSequence(), size);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the entry with the smallest virtual finish time.
     */
    public Optional<FairQueueEntry<T>> dequeue() {
        lock.lock();
        try {
            if (heads.isEmpty()) {
                return Optional.empty();
            }
            FairQueueEntry<T> first = heads.first();
            removeLocked(first);
            advance(first);
            return Optional.of(first);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the smallest entry that passes {@code eligible}. Entries that fail
     * keep their place. The predicate runs under the queue lock and must not block.
     */
    public Optional<FairQueueEntry<T>> dequeue(Predicate<FairQueueEntry<T>> eligible) {
        lock.lock();
        try {
            for (FairQueueEntry<T> head : heads) {
                if (eligible.test(head)) {
                    removeLocked(head);
                    advance(head);
                    return Optional.of(head);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of each tenant's oldest entry, in service order.
     * Only heads can be served: a tenant's later entries always wait behind its head.
     */
    public List<FairQueueEntry<T>> heads() {
        lock.lock();
        try {
            return new ArrayList<>(heads);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes an entry for service and advances the virtual time to its finish time.
     *
     * @return false if the entry is no longer queued (cancelled, expired or already taken)
     */
    public boolean take(FairQueueEntry<T> entry) {
        lock.lock();
        try {
            if (!removeLocked(entry)) {
                return false;
            }
            advance(entry);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes exactly this entry without serving it. Other entries keep their order.
     */
    public boolean remove(FairQueueEntry<T> entry) {
        lock.lock();
        try {
            return removeLocked(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns every entry past its deadline.
     */
    public List<FairQueueEntry<T>> removeExpired(long nowNanos) {
        lock.lock();
        try {
            List<FairQueueEntry<T>> expired = new ArrayList<>();
            for (ArrayDeque<FairQueueEntry<T>> fifo : byTenant.values()) {
                for (FairQueueEntry<T> entry : fifo) {
                    if (entry.isExpired(nowNanos)) {
                        expired.add(entry);
                    }
                }
            }
            for (FairQueueEntry<T> entry : expired) {
                removeLocked(entry);
            }
            return expired;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Empties the queue and returns the removed entries in service order.
     */
    public List<FairQueueEntry<T>> drainAll() {
        lock.lock();
        try {
            List<FairQueueEntry<T>> all = new ArrayList<>(size);
            for (ArrayDeque<FairQueueEntry<T>> fifo : byTenant.values()) {
                all.addAll(fifo);
            }
            all.sort(FairQueueEntry.ORDER);
            byTenant.clear();
            heads.clear();
            size = 0;
            return all;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public int size(String tenantId) {
        lock.lock();
        try {
            ArrayDeque<FairQueueEntry<T>> fifo = byTenant.get(tenantId);
            return fifo == null ? 0 : fifo.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public double virtualTime() {
        lock.lock();
        try {
            return virtualTime;
        } finally {
            lock.unlock();
        }
    }

    private void advance(FairQueueEntry<T> served) {
        virtualTime = Math.max(virtualTime, served.getVirtualFinishTime());
    }

    private boolean removeLocked(FairQueueEntry<T> entry) {
        ArrayDeque<FairQueueEntry<T>> fifo = byTenant.get(entry.getTenantId());
        if (fifo == null) {
            return false;
        }
        boolean wasHead = fifo.peekFirst() == entry;
        if (!fifo.removeFirstOccurrence(entry)) {
            return false;
        }
        size--;
        if (wasHead) {
            heads.remove(entry);
            FairQueueEntry<T> next = fifo.peekFirst();
            if (next != null) {
                heads.add(next);
            }
        }
        if (fifo.isEmpty()) {
            byTenant.remove(entry.getTenantId());
        }
        return true;
    }
}
