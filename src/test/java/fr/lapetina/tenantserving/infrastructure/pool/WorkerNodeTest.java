package fr.lapetina.tenantserving.infrastructure.pool;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerNodeTest {

    private WorkerNode node;

    @BeforeEach
    void setUp() {
        node = WorkerNode.builder()
                .id("test-node")
                .maxConcurrent(3)
                .weight(2)
                .build();
    }

    @Test
    @DisplayName("should create node with builder")
    void shouldCreateNodeWithBuilder() {
        assertThat(node.getId()).isEqualTo("test-node");
        assertThat(node.getMaxConcurrent()).isEqualTo(3);
        assertThat(node.getWeight()).isEqualTo(2);
        assertThat(node.isEnabled()).isTrue();
        assertThat(node.getHealth()).isEqualTo(NodeHealth.UP);
    }

    @Test
    @DisplayName("should enforce max concurrent slots")
    void shouldEnforceMaxConcurrent() {
        assertThat(node.tryAcquireSlot()).isTrue();
        assertThat(node.tryAcquireSlot()).isTrue();
        assertThat(node.tryAcquireSlot()).isTrue();

        // Should fail - at capacity
        assertThat(node.tryAcquireSlot()).isFalse();
        assertThat(node.isAvailable()).isFalse();

        node.releaseSlot();

        assertThat(node.tryAcquireSlot()).isTrue();
    }

    @Test
    @DisplayName("should not release below zero")
    void shouldNotReleaseBelowZero() {
        assertThat(node.releaseSlot()).isFalse();
        assertThat(node.getInFlight()).isZero();
    }

    @Test
    @DisplayName("should compute load ratio by weight")
    void shouldComputeLoadRatio() {
        node.tryAcquireSlot();

        assertThat(node.getLoadRatio()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("should report previous health on change")
    void shouldTrackHealth() {
        assertThat(node.setHealth(NodeHealth.DEGRADED)).isEqualTo(NodeHealth.UP);
        assertThat(node.isActive()).isTrue();

        assertThat(node.setHealth(NodeHealth.DOWN)).isEqualTo(NodeHealth.DEGRADED);
        assertThat(node.isActive()).isFalse();
        assertThat(node.isAvailable()).isFalse();
    }

    @Test
    @DisplayName("should reject invalid settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> WorkerNode.builder().id("x").maxConcurrent(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WorkerNode.builder().id("x").weight(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WorkerNode.builder().build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("should be thread-safe for concurrent slot operations")
    void shouldBeThreadSafeForSlotOperations() throws InterruptedException {
        int threads = 10;
        int iterations = 1000;
        CountDownLatch latch = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        AtomicInteger overCapacity = new AtomicInteger(0);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < iterations; i++) {
                        if (node.tryAcquireSlot()) {
                            if (node.getInFlight() > node.getMaxConcurrent()) {
                                overCapacity.incrementAndGet();
                            }
                            Thread.yield();
                            node.releaseSlot();
                        }
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        latch.await();
        executor.shutdown();

        assertThat(overCapacity.get()).isZero();
        assertThat(node.getInFlight()).isZero();
    }
}
