package fr.lapetina.tenantserving;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identity of the plugin as seen by its host.
 */
public final class TenantServingPlugin {

    private static final Logger log = LoggerFactory.getLogger(TenantServingPlugin.class);

    public static final String NAME = "multi-tenant-serving";
    public static final String VERSION = "0.1.0";

    public String name() {
        return NAME;
    }

    public String version() {
        return VERSION;
    }

    public void initialize() {
        log.info("Initializing {} plugin v{}", NAME, VERSION);
    }
}
