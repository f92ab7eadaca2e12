package fr.lapetina.tenantserving;

import fr.lapetina.tenantserving.api.HttpServer;
import fr.lapetina.tenantserving.infrastructure.config.ServingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for running the admission layer standalone with its operational HTTP server.
 * Leases are completed by whoever holds them; the standalone process serves only health,
 * metrics and administration.
 */
public class TenantServingApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TenantServingApplication.class);

    private final TenantServingPlugin plugin = new TenantServingPlugin();
    private final ServingFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public TenantServingApplication(String configPath) throws Exception {
        plugin.initialize();

        // Create and start the factory
        this.factory = ServingFactory.create(configPath).start();

        ServingConfig.ServerConfig server = factory.getConfig().getServer();
        if (server.isEnabled()) {
            this.httpServer = new HttpServer(
                    server.getHost(),
                    server.getPort(),
                    server.getBacklog(),
                    server.getThreads(),
                    factory.getController(),
                    factory.getConfig().getMetrics().isEnabled() ? factory.getMetricsRegistry() : null,
                    factory.getConfigLoader()
            );
        } else {
            this.httpServer = null;
        }

        log.info("{} v{} initialized", plugin.name(), plugin.version());
    }

    public void start() {
        if (httpServer != null) {
            httpServer.start();
            log.info("{} started on port {}", plugin.name(), httpServer.getPort());
        } else {
            log.info("{} started without HTTP server", plugin.name());
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public ServingFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down {}...", plugin.name());

        if (httpServer != null) {
            try {
                httpServer.close();
            } catch (Exception e) {
                log.warn("Error closing HTTP server", e);
            }
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("{} shut down", plugin.name());
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            TenantServingApplication app = new TenantServingApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start {}", TenantServingPlugin.NAME, e);
            System.exit(1);
        }
    }
}
