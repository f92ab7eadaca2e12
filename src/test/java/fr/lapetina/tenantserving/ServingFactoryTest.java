package fr.lapetina.tenantserving;

import fr.lapetina.tenantserving.admission.AdmissionController;
import fr.lapetina.tenantserving.domain.clock.ManualClock;
import fr.lapetina.tenantserving.admission.RequestBackend;
import fr.lapetina.tenantserving.domain.model.AdmissionOutcome;
import fr.lapetina.tenantserving.domain.model.OutcomeStatus;
import fr.lapetina.tenantserving.infrastructure.config.ConfigLoader;
import fr.lapetina.tenantserving.infrastructure.pool.NodeHealth;
import fr.lapetina.tenantserving.infrastructure.pool.NodeResourcePool;
import fr.lapetina.tenantserving.infrastructure.pool.SlotResourcePool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServingFactoryTest {

    @TempDir
    Path tempDir;

    private static AdmissionOutcome submit(AdmissionController controller, String tenantId) throws Exception {
        return controller.submit(tenantId).outcome().get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("should wire a slot pool and tenant policies from configuration")
    void shouldWireSlotPool() throws Exception {
        try (ServingFactory factory = ServingFactory.create("test-config.yaml").start()) {
            AdmissionController controller = factory.getController();

            assertThat(factory.getPool()).isInstanceOf(SlotResourcePool.class);
            assertThat(factory.getPool().getName()).isEqualTo("test-pool");
            assertThat(controller.poolCapacity().total()).isEqualTo(2);
            assertThat(factory.getRegistry().lookup("tenant-a").weight()).isEqualTo(2);
            assertThat(factory.getRegistry().getDefaultPolicy().maxConcurrent()).isEqualTo(5);
            assertThat(factory.getMetricsRegistry().getPrefix()).isEqualTo("test_serving");

            AdmissionOutcome outcome = submit(controller, "tenant-a");
            assertThat(outcome.status()).isEqualTo(OutcomeStatus.DISPATCHED);
            assertThat(controller.complete(outcome.lease())).isTrue();
        }
    }

    @Test
    @DisplayName("should wire a node pool with strict registration")
    void shouldWireNodePool() throws Exception {
        try (ServingFactory factory = ServingFactory.create("test-nodes-config.yaml").start()) {
            AdmissionController controller = factory.getController();

            assertThat(factory.getPool()).isInstanceOf(NodeResourcePool.class);
            // node-3 is disabled
            assertThat(controller.poolCapacity().total()).isEqualTo(3);
            assertThat(submit(controller, "walk-in").status()).isEqualTo(OutcomeStatus.UNKNOWN_TENANT);

            ((NodeResourcePool) factory.getPool()).markHealth("node-1", NodeHealth.DOWN);
            assertThat(controller.poolCapacity().total()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should apply policy changes on reload")
    void shouldApplyReload() throws Exception {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, "tenants:\n  - id: gold\n    weight: 2\n");

        try (ServingFactory factory = new ServingFactory(file.toString(), RequestBackend.callerManaged(),
                new ManualClock())) {
            factory.start();
            assertThat(factory.getRegistry().lookup("gold").weight()).isEqualTo(2);

            Files.writeString(file, "admission:\n  strictRegistration: true\n"
                    + "  defaultPolicy:\n    maxConcurrent: 7\n"
                    + "tenants:\n  - id: gold\n    weight: 5\n  - id: silver\n");
            factory.getConfigLoader().reload();

            assertThat(factory.getRegistry().lookup("gold").weight()).isEqualTo(5);
            assertThat(factory.getRegistry().isRegistered("silver")).isTrue();
            assertThat(factory.getRegistry().lookup("silver").maxConcurrent()).isEqualTo(7);
            assertThat(factory.getController().submit("walk-in").outcome().get(5, TimeUnit.SECONDS).status())
                    .isEqualTo(OutcomeStatus.UNKNOWN_TENANT);
        }
    }

    @Test
    @DisplayName("should reject an unknown pool type")
    void shouldRejectUnknownPoolType() throws Exception {
        Path file = tempDir.resolve("bad.yaml");
        Files.writeString(file, "pool:\n  type: quantum\n");

        assertThatThrownBy(() -> ServingFactory.create(file.toString()))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("quantum");
    }

    @Test
    @DisplayName("should reject queued work once closed")
    void shouldStopOnClose() throws Exception {
        ServingFactory factory = ServingFactory.create("test-config.yaml").start();
        AdmissionController controller = factory.getController();

        factory.close();

        assertThat(controller.isRunning()).isFalse();
        assertThat(factory.getPool().isAvailable()).isFalse();
        assertThatThrownBy(() -> controller.submit("tenant-a")).isInstanceOf(IllegalStateException.class);
    }
}
