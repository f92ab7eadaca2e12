package fr.lapetina.tenantserving.infrastructure.config;

import fr.lapetina.tenantserving.domain.model.TenantPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the serving configuration and re-applies tenant policies while running.
 *
 * The file system is tried first, then the classpath. Every configuration is validated
 * before it replaces the current one. Only tenant settings (the tenant table, the default
 * policy and strict registration) change at runtime, so listeners are notified only when
 * a load changes one of them.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final AtomicReference<ServingConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private ScheduledExecutorService poller;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(ServingConfig.class, new LoaderOptions()));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public ServingConfig load() {
        return apply(validate(read()), configPath.toString());
    }

    /**
     * Loads configuration from an input stream.
     */
    public ServingConfig loadFromStream(InputStream inputStream) {
        return apply(validate(parse(inputStream, "stream")), "stream");
    }

    /**
     * Re-reads the configuration. A configuration that fails to load or validate is
     * logged and the current one is kept.
     */
    public ServingConfig reload() {
        try {
            return load();
        } catch (RuntimeException e) {
            log.error("Configuration rejected, tenant policies unchanged: path={}", configPath, e);
            return currentConfig.get();
        }
    }

    private ServingConfig apply(ServingConfig config, String source) {
        ServingConfig previous = currentConfig.getAndSet(config);
        if (previous != null && TenantSettings.of(previous).equals(TenantSettings.of(config))) {
            log.debug("Configuration from {} leaves tenant settings unchanged", source);
            return config;
        }
        log.info("Configuration applied from {}: tenants={}, strictRegistration={}",
                source, config.getTenants().size(), config.getAdmission().isStrictRegistration());
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, config);
            } catch (Exception e) {
                log.error("Config change listener failed: listener={}", listener, e);
            }
        }
        return config;
    }

    private ServingConfig read() {
        if (Files.exists(configPath)) {
            try {
                lastModified = Files.getLastModifiedTime(configPath).toMillis();
                try (InputStream is = Files.newInputStream(configPath)) {
                    return parse(is, configPath.toString());
                }
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read configuration: " + configPath, e);
            }
        }

        String resource = configPath.toString().replaceFirst("^/", "");
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                log.info("Reading configuration from classpath resource {}", resource);
                return parse(is, resource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath resource: " + resource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private ServingConfig parse(InputStream inputStream, String source) {
        try {
            ServingConfig config = yaml.load(inputStream);
            // Empty document
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private static ServingConfig validate(ServingConfig config) {
        if (config.getAdmission().getSweepIntervalMs() <= 0) {
            throw new ConfigurationException("admission.sweepIntervalMs must be > 0");
        }
        int ringBufferSize = config.getAdmission().getRingBufferSize();
        if (ringBufferSize < 1 || Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("admission.ringBufferSize must be a power of 2, got " + ringBufferSize);
        }
        config.tenantPolicies();
        return config;
    }

    public ServingConfig getCurrentConfig() {
        return currentConfig.get();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Polls the configuration file once a second and reloads it when its modification
     * time moves. A classpath configuration is never watched.
     */
    public void startWatching() {
        startWatching(DEFAULT_POLL_INTERVAL);
    }

    public synchronized void startWatching(Duration pollInterval) {
        if (poller != null) {
            return;
        }
        if (!Files.exists(configPath)) {
            log.info("No configuration file on disk, tenant policies will not hot-reload: {}", configPath);
            return;
        }

        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tenant-config-poller");
            t.setDaemon(true);
            return t;
        });
        long periodMs = Math.max(1, pollInterval.toMillis());
        poller.scheduleWithFixedDelay(this::reloadIfModified, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Watching {} for tenant policy changes every {} ms", configPath, periodMs);
    }

    private void reloadIfModified() {
        try {
            if (!Files.exists(configPath)) {
                return;
            }
            long modified = Files.getLastModifiedTime(configPath).toMillis();
            if (modified != lastModified) {
                log.info("Configuration file modified, reloading: {}", configPath);
                reload();
            }
        } catch (IOException e) {
            log.warn("Cannot stat configuration file {}: {}", configPath, e.getMessage());
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public synchronized void close() {
        if (poller == null) {
            return;
        }
        poller.shutdownNow();
        try {
            poller.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        poller = null;
    }

    /**
     * Creates a default configuration.
     */
    public static ServingConfig createDefault() {
        return new ServingConfig();
    }

    /**
     * The part of a configuration that a running controller picks up.
     */
    private record TenantSettings(TenantPolicy defaultPolicy, Map<String, TenantPolicy> tenants, boolean strict) {

        static TenantSettings of(ServingConfig config) {
            return new TenantSettings(
                    config.getAdmission().getDefaultPolicy().toPolicy(TenantPolicy.defaults()),
                    config.tenantPolicies(),
                    config.getAdmission().isStrictRegistration());
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
