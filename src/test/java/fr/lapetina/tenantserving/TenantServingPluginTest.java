package fr.lapetina.tenantserving;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TenantServingPluginTest {

    @Test
    @DisplayName("should expose name and version")
    void shouldExposeIdentity() {
        TenantServingPlugin plugin = new TenantServingPlugin();
        plugin.initialize();

        assertThat(plugin.name()).isEqualTo("multi-tenant-serving");
        assertThat(plugin.version()).isEqualTo(TenantServingPlugin.VERSION);
    }

    @Test
    @DisplayName("should start and stop the application without HTTP server")
    void shouldRunApplication() throws Exception {
        TenantServingApplication app = new TenantServingApplication("test-config.yaml");
        app.start();

        assertThat(app.getFactory().getController().isRunning()).isTrue();

        app.requestShutdown();
        app.awaitShutdown();
        app.close();

        assertThat(app.getFactory().getController().isRunning()).isFalse();
    }
}
