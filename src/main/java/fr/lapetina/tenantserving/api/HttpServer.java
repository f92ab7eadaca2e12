package fr.lapetina.tenantserving.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.tenantserving.TenantServingPlugin;
import fr.lapetina.tenantserving.admission.AdmissionController;
import fr.lapetina.tenantserving.api.dto.TenantPolicyRequest;
import fr.lapetina.tenantserving.api.dto.TenantView;
import fr.lapetina.tenantserving.domain.model.PoolCapacity;
import fr.lapetina.tenantserving.domain.model.TenantPolicy;
import fr.lapetina.tenantserving.domain.tenant.TenantRegistry;
import fr.lapetina.tenantserving.domain.tenant.TenantState;
import fr.lapetina.tenantserving.infrastructure.config.ConfigLoader;
import fr.lapetina.tenantserving.infrastructure.config.ServingConfig;
import fr.lapetina.tenantserving.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.tenantserving.infrastructure.pool.NodeHealth;
import fr.lapetina.tenantserving.infrastructure.pool.NodeResourcePool;
import fr.lapetina.tenantserving.infrastructure.pool.ResourcePool;
import fr.lapetina.tenantserving.infrastructure.pool.WorkerNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Operational HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /health - Pool availability and queue depth
 * - GET /metrics - Prometheus metrics endpoint, absent when metrics are disabled
 * - GET /admin/tenants - List known tenants with policy and counters
 * - GET /admin/tenants/{id} - One tenant (default policy if unregistered)
 * - PUT /admin/tenants/{id} - Set a tenant's policy
 * - GET /admin/nodes - List worker nodes (node pools only)
 * - POST /admin/nodes/{id}/enable - Mark a node UP
 * - POST /admin/nodes/{id}/disable - Mark a node DOWN
 * - POST /admin/reload - Reload configuration
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final AdmissionController controller;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int threads,
            AdmissionController controller,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader
    ) throws IOException {
        this.controller = controller;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "http-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/health", new HealthHandler());
        if (metricsRegistry != null) {
            server.createContext("/metrics", new MetricsHandler());
        }
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on {}:{}", host, getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * The bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            ResourcePool pool = controller.getPool();
            boolean available = controller.isRunning() && pool.isAvailable();
            PoolCapacity capacity = pool.capacity();

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", available ? "UP" : "DOWN");
            health.put("plugin", TenantServingPlugin.NAME);
            health.put("version", TenantServingPlugin.VERSION);
            health.put("timestamp", System.currentTimeMillis());

            Map<String, Object> poolStats = new LinkedHashMap<>();
            poolStats.put("name", pool.getName());
            poolStats.put("available", pool.isAvailable());
            poolStats.put("used", capacity.used());
            poolStats.put("total", capacity.total());
            health.put("pool", poolStats);

            Map<String, Object> admission = new LinkedHashMap<>();
            admission.put("queued", controller.queueSize());
            admission.put("activeLeases", controller.activeLeaseCount());
            admission.put("ringBufferRemaining", controller.getRemainingCapacity());
            admission.put("tenants", controller.getRegistry().size());
            health.put("admission", admission);

            sendJson(exchange, available ? 200 : 503, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/tenants") && "GET".equals(method)) {
                    handleListTenants(exchange);
                } else if (path.matches("/admin/tenants/[^/]+") && "GET".equals(method)) {
                    handleGetTenant(exchange, tenantIdOf(path));
                } else if (path.matches("/admin/tenants/[^/]+") && "PUT".equals(method)) {
                    handlePutTenant(exchange, tenantIdOf(path));
                } else if (path.equals("/admin/nodes") && "GET".equals(method)) {
                    handleListNodes(exchange);
                } else if (path.matches("/admin/nodes/[^/]+/enable") && "POST".equals(method)) {
                    handleNodeAction(exchange, path, true);
                } else if (path.matches("/admin/nodes/[^/]+/disable") && "POST".equals(method)) {
                    handleNodeAction(exchange, path, false);
                } else if (path.equals("/admin/reload") && "POST".equals(method)) {
                    handleReloadConfig(exchange);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private String tenantIdOf(String path) {
            return URLDecoder.decode(path.substring("/admin/tenants/".length()), StandardCharsets.UTF_8);
        }

        private void handleListTenants(HttpExchange exchange) throws IOException {
            TenantRegistry registry = controller.getRegistry();
            SortedSet<String> ids = new TreeSet<>(registry.tenants().keySet());
            for (TenantState state : registry.states()) {
                ids.add(state.getTenantId());
            }

            List<TenantView> tenants = new ArrayList<>();
            for (String id : ids) {
                tenants.add(viewOf(id));
            }
            sendJson(exchange, 200, tenants);
        }

        private void handleGetTenant(HttpExchange exchange, String tenantId) throws IOException {
            if (tenantId.isBlank()) {
                sendError(exchange, 400, "Tenant ID must not be blank");
                return;
            }
            sendJson(exchange, 200, viewOf(tenantId));
        }

        private void handlePutTenant(HttpExchange exchange, String tenantId) throws IOException {
            if (tenantId.isBlank()) {
                sendError(exchange, 400, "Tenant ID must not be blank");
                return;
            }
            TenantPolicyRequest request;
            try (InputStream is = exchange.getRequestBody()) {
                request = objectMapper.readValue(is, TenantPolicyRequest.class);
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Invalid JSON body: " + e.getOriginalMessage());
                return;
            }

            TenantPolicy policy;
            try {
                policy = request.toPolicy(controller.getRegistry().getDefaultPolicy());
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
                return;
            }

            controller.setPolicy(tenantId, policy);
            log.info("Tenant policy set via admin API: tenantId={}, policy={}", tenantId, policy);
            sendJson(exchange, 200, viewOf(tenantId));
        }

        // Read-only: looking a tenant up must not give it runtime state
        private TenantView viewOf(String tenantId) {
            TenantRegistry registry = controller.getRegistry();
            Optional<TenantState> state = registry.findState(tenantId);
            return TenantView.of(
                    tenantId,
                    registry.isRegistered(tenantId),
                    registry.lookup(tenantId),
                    state.map(TenantState::getInFlight).orElse(0),
                    controller.queueSize(tenantId),
                    state.map(TenantState::getDispatchedCount).orElse(0L),
                    state.map(TenantState::getRejectedCount).orElse(0L)
            );
        }

        private void handleListNodes(HttpExchange exchange) throws IOException {
            if (!(controller.getPool() instanceof NodeResourcePool nodePool)) {
                sendError(exchange, 404, "Pool has no worker nodes");
                return;
            }
            List<Map<String, Object>> nodes = new ArrayList<>();
            for (WorkerNode node : nodePool.getNodes()) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("id", node.getId());
                info.put("health", node.getHealth().name());
                info.put("enabled", node.isEnabled());
                info.put("weight", node.getWeight());
                info.put("maxConcurrent", node.getMaxConcurrent());
                info.put("inFlight", node.getInFlight());
                nodes.add(info);
            }
            sendJson(exchange, 200, nodes);
        }

        private void handleNodeAction(HttpExchange exchange, String path, boolean enable) throws IOException {
            if (!(controller.getPool() instanceof NodeResourcePool nodePool)) {
                sendError(exchange, 404, "Pool has no worker nodes");
                return;
            }

            // Extract node ID from path
            String nodeId = path.split("/")[3];
            if (nodePool.getNode(nodeId).isEmpty()) {
                sendError(exchange, 404, "Node not found: " + nodeId);
                return;
            }

            nodePool.markHealth(nodeId, enable ? NodeHealth.UP : NodeHealth.DOWN);
            sendJson(exchange, 200, Map.of(
                    "node", nodeId,
                    "action", enable ? "enabled" : "disabled"
            ));
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            if (configLoader == null) {
                sendError(exchange, 404, "No configuration file to reload");
                return;
            }
            ServingConfig newConfig = configLoader.reload();
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "tenants", newConfig.getTenants().size()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "Unknown error");
        sendJson(exchange, statusCode, error);
    }
}
