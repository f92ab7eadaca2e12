package fr.lapetina.tenantserving.infrastructure.pool;

import fr.lapetina.tenantserving.domain.model.PoolCapacity;
import fr.lapetina.tenantserving.domain.model.PoolLease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Pool whose capacity is the sum of its active worker nodes.
 *
 * A lease lands on the available node with the lowest in-flight/weight ratio, ties broken
 * by node ID. Nodes marked DOWN stop contributing capacity; their outstanding leases can
 * still be released. The pool is unavailable when no enabled node is UP or DEGRADED.
 */
public final class NodeResourcePool implements ResourcePool {

    private static final Logger log = LoggerFactory.getLogger(NodeResourcePool.class);

    private static final Comparator<WorkerNode> LEAST_LOADED = Comparator
            .comparingDouble(WorkerNode::getLoadRatio)
            .thenComparing(WorkerNode::getId);

    private final String name;
    private final Map<String, WorkerNode> nodes = new LinkedHashMap<>();
    private final Map<String, HeldNode> outstanding = new ConcurrentHashMap<>();
    private final List<Consumer<NodeHealthEvent>> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public NodeResourcePool(Collection<WorkerNode> workerNodes) {
        this("nodes", workerNodes);
    }

    public NodeResourcePool(String name, Collection<WorkerNode> workerNodes) {
        if (workerNodes.isEmpty()) {
            throw new IllegalArgumentException("At least one worker node is required");
        }
        this.name = name;
        for (WorkerNode node : workerNodes) {
            if (nodes.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate worker node ID: " + node.getId());
            }
        }
        log.info("NodeResourcePool created: name={}, nodes={}, capacity={}",
                name, nodes.size(), capacity().total());
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

        List<WorkerNode> candidates = nodes.values().stream()
                .filter(WorkerNode::isAvailable)
                .sorted(LEAST_LOADED)
                .toList();

        for (WorkerNode node : candidates) {
            // Another thread may fill the node between the filter and the CAS
            if (node.isActive() && node.tryAcquireSlot()) {
                PoolLease lease = new PoolLease(
                        UUID.randomUUID().toString(),
                        node.getId(),
                        tenantId,
                        requestId,
                        Instant.now()
                );
                outstanding.put(lease.leaseId(), new HeldNode(lease, node));

                log.debug("Node lease acquired: pool={}, nodeId={}, tenantId={}, requestId={}, nodeInFlight={}/{}",
                        name, node.getId(), tenantId, requestId, node.getInFlight(), node.getMaxConcurrent());
                return Optional.of(lease);
            }
        }
        return Optional.empty();
    }

    @Override
    public void release(PoolLease lease) {
        HeldNode held = outstanding.get(lease.leaseId());
        if (held == null || !held.lease().equals(lease)) {
            throw new LeaseAccountingException(lease.leaseId(), "unknown or already released lease in pool " + name);
        }
        if (!outstanding.remove(lease.leaseId(), held)) {
            throw new LeaseAccountingException(lease.leaseId(), "lease released concurrently in pool " + name);
        }
        if (!held.node().releaseSlot()) {
            throw new LeaseAccountingException(lease.leaseId(), "negative capacity on node " + held.node().getId());
        }

        log.debug("Node lease released: pool={}, nodeId={}, tenantId={}, nodeInFlight={}/{}",
                name, held.node().getId(), lease.tenantId(),
                held.node().getInFlight(), held.node().getMaxConcurrent());
    }

    /**
     * Capacity over active nodes only: a DOWN or disabled node offers nothing.
     */
    @Override
    public PoolCapacity capacity() {
        int used = 0;
        int total = 0;
        for (WorkerNode node : nodes.values()) {
            if (node.isActive()) {
                used += node.getInFlight();
                total += node.getMaxConcurrent();
            }
        }
        return new PoolCapacity(used, total);
    }

    @Override
    public boolean isAvailable() {
        return !closed && nodes.values().stream().anyMatch(WorkerNode::isActive);
    }

    /**
     * Updates the health of a node, as reported by the host.
     *
     * @throws IllegalArgumentException if the node is unknown
     */
    public void markHealth(String nodeId, NodeHealth health) {
        WorkerNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown worker node: " + nodeId);
        }
        NodeHealth previous = node.setHealth(health);
        if (previous != health) {
            log.info("Node health changed: pool={}, nodeId={}, {} -> {}", name, nodeId, previous, health);
            notifyListeners(new NodeHealthEvent(node, previous, health));
        }
    }

    public Optional<WorkerNode> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public List<WorkerNode> getNodes() {
        return new ArrayList<>(nodes.values());
    }

    public void addListener(Consumer<NodeHealthEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<NodeHealthEvent> listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.info("NodeResourcePool closed: name={}, outstandingLeases={}", name, outstanding.size());
        }
    }

    private void notifyListeners(NodeHealthEvent event) {
        for (Consumer<NodeHealthEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    private record HeldNode(PoolLease lease, WorkerNode node) {
    }

    /**
     * Health transition of a worker node.
     */
    public record NodeHealthEvent(WorkerNode node, NodeHealth previous, NodeHealth current) {
    }
}
