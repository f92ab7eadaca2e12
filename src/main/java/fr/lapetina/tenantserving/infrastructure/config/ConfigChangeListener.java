package fr.lapetina.tenantserving.infrastructure.config;

/**
 * Receives every successfully validated configuration, the initial load included.
 *
 * Runs on the thread that loaded the file (the caller of {@link ConfigLoader#load()},
 * an admin reload, or the file watcher). An exception thrown here is logged and does not
 * stop the other listeners.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * @param oldConfig the configuration being replaced, null on the initial load
     * @param newConfig the configuration now in effect
     */
    void onConfigChanged(ServingConfig oldConfig, ServingConfig newConfig);
}
