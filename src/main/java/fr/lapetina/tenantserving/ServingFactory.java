package fr.lapetina.tenantserving;

import fr.lapetina.tenantserving.admission.AdmissionController;
import fr.lapetina.tenantserving.admission.RequestBackend;
import fr.lapetina.tenantserving.domain.clock.Clock;
import fr.lapetina.tenantserving.domain.clock.SystemClock;
import fr.lapetina.tenantserving.domain.model.TenantPolicy;
import fr.lapetina.tenantserving.domain.tenant.TenantRegistry;
import fr.lapetina.tenantserving.infrastructure.config.ConfigLoader;
import fr.lapetina.tenantserving.infrastructure.config.ServingConfig;
import fr.lapetina.tenantserving.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.tenantserving.infrastructure.pool.NodeResourcePool;
import fr.lapetina.tenantserving.infrastructure.pool.ResourcePool;
import fr.lapetina.tenantserving.infrastructure.pool.SlotResourcePool;
import fr.lapetina.tenantserving.infrastructure.pool.WorkerNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Factory for creating a fully-wired admission controller from configuration.
 * This is the primary entry point for embedding the admission layer.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ServingFactory factory = ServingFactory.create("config.yaml", backend).start()) {
 *     AdmissionController controller = factory.getController();
 *     RequestHandle handle = controller.submit("tenant-a");
 *     // ...
 * }
 * }</pre>
 */
public class ServingFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServingFactory.class);

    private final ConfigLoader configLoader;
    private final ServingConfig config;
    private final TenantRegistry registry;
    private final MetricsRegistry metricsRegistry;
    private final ResourcePool pool;
    private final AdmissionController controller;

    protected ServingFactory(String configPath, RequestBackend backend, Clock clock) {
        log.info("Initializing ServingFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Initialize tenant registry
        this.registry = new TenantRegistry(defaultPolicyOf(config));
        registry.replaceAll(config.tenantPolicies());

        this.pool = createPool(config.getPool());

        this.controller = AdmissionController.builder()
                .fromConfig(config)
                .registry(registry)
                .pool(pool)
                .backend(backend)
                .clock(clock)
                .metrics(metricsRegistry)
                .build();

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("ServingFactory initialized: tenants={}, pool={}, capacity={}",
                registry.size(), pool.getName(), pool.capacity());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ServingFactory create(String configPath, RequestBackend backend) {
        return new ServingFactory(configPath, backend, SystemClock.instance());
    }

    /**
     * Creates a factory whose callers complete their leases themselves.
     */
    public static ServingFactory create(String configPath) {
        return create(configPath, RequestBackend.callerManaged());
    }

    /**
     * Starts the controller and the configuration watcher.
     */
    public ServingFactory start() {
        controller.start();
        configLoader.startWatching();
        log.info("Admission layer started");
        return this;
    }

    public AdmissionController getController() {
        return controller;
    }

    public TenantRegistry getRegistry() {
        return registry;
    }

    public ResourcePool getPool() {
        return pool;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ServingConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private static TenantPolicy defaultPolicyOf(ServingConfig config) {
        return config.getAdmission().getDefaultPolicy().toPolicy(TenantPolicy.defaults());
    }

    private ResourcePool createPool(ServingConfig.PoolConfig poolConfig) {
        String type = poolConfig.getType() == null ? "slots" : poolConfig.getType().toLowerCase();
        switch (type) {
            case "slots":
                return new SlotResourcePool(poolConfig.getName(), poolConfig.getCapacity());
            case "nodes":
                List<WorkerNode> nodes = new ArrayList<>();
                for (ServingConfig.NodeConfig nodeConfig : poolConfig.getNodes()) {
                    WorkerNode node = WorkerNode.builder()
                            .id(nodeConfig.getId())
                            .maxConcurrent(nodeConfig.getMaxConcurrent())
                            .weight(nodeConfig.getWeight())
                            .enabled(nodeConfig.isEnabled())
                            .build();
                    nodes.add(node);
                    log.debug("Registered node: {}", node);
                }
                NodeResourcePool nodePool = new NodeResourcePool(poolConfig.getName(), nodes);
                nodePool.addListener(event -> log.info("Node health changed: nodeId={}, {} -> {}",
                        event.node().getId(), event.previous(), event.current()));
                return nodePool;
            default:
                throw new ConfigLoader.ConfigurationException("Unknown pool type: " + poolConfig.getType());
        }
    }

    /**
     * Re-applies tenant policies, the default policy and strict registration.
     * Pool and pipeline settings need a restart.
     */
    private void onConfigChanged(ServingConfig oldConfig, ServingConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");

        registry.setDefaultPolicy(defaultPolicyOf(newConfig));
        registry.replaceAll(newConfig.tenantPolicies());
        controller.setStrictRegistration(newConfig.getAdmission().isStrictRegistration());

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down ServingFactory...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        try {
            controller.close();
        } catch (Exception e) {
            log.warn("Error closing admission controller", e);
        }

        try {
            pool.close();
        } catch (Exception e) {
            log.warn("Error closing resource pool", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ServingFactory shut down");
    }
}
