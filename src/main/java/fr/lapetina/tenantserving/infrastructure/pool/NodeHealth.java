package fr.lapetina.tenantserving.infrastructure.pool;

/**
 * Health status of a worker node.
 *
 * UP: Node is healthy and accepting leases
 * DEGRADED: Node is responding with issues; it still accepts leases
 * DOWN: Node is not responding or explicitly marked offline
 */
public enum NodeHealth {
    UP,
    DEGRADED,
    DOWN
}
