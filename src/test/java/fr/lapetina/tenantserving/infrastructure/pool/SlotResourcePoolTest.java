package fr.lapetina.tenantserving.infrastructure.pool;

import fr.lapetina.tenantserving.domain.model.PoolLease;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotResourcePoolTest {

    private SlotResourcePool pool;

    @BeforeEach
    void setUp() {
        pool = new SlotResourcePool("test", 2);
    }

    @Test
    @DisplayName("should lease up to capacity")
    void shouldLeaseUpToCapacity() {
        Optional<PoolLease> first = pool.tryAcquire("a", "r1");
        Optional<PoolLease> second = pool.tryAcquire("b", "r2");

        assertThat(first).isPresent();
        assertThat(second).isPresent();
        assertThat(pool.tryAcquire("c", "r3")).isEmpty();
        assertThat(pool.capacity().used()).isEqualTo(2);
        assertThat(pool.capacity().hasFree()).isFalse();

        assertThat(first.get().tenantId()).isEqualTo("a");
        assertThat(first.get().requestId()).isEqualTo("r1");
        assertThat(first.get().resourceId()).startsWith("test-");
        assertThat(first.get().resourceId()).isNotEqualTo(second.get().resourceId());
    }

    @Test
    @DisplayName("should free capacity on release")
    void shouldFreeOnRelease() {
        PoolLease lease = pool.tryAcquire("a", "r1").orElseThrow();
        pool.tryAcquire("a", "r2").orElseThrow();

        pool.release(lease);

        assertThat(pool.capacity().used()).isEqualTo(1);
        assertThat(pool.capacity().free()).isEqualTo(1);
        assertThat(pool.tryAcquire("b", "r3")).isPresent();
    }

    @Test
    @DisplayName("should refuse a double release")
    void shouldRefuseDoubleRelease() {
        PoolLease lease = pool.tryAcquire("a", "r1").orElseThrow();
        pool.release(lease);

        assertThatThrownBy(() -> pool.release(lease))
                .isInstanceOf(LeaseAccountingException.class)
                .satisfies(e -> assertThat(((LeaseAccountingException) e).getLeaseId()).isEqualTo(lease.leaseId()));
        assertThat(pool.capacity().used()).isZero();
    }

    @Test
    @DisplayName("should refuse a foreign lease")
    void shouldRefuseForeignLease() {
        PoolLease foreign = new PoolLease("nope", "elsewhere-0", "a", "r1", Instant.now());

        assertThatThrownBy(() -> pool.release(foreign)).isInstanceOf(LeaseAccountingException.class);
    }

    @Test
    @DisplayName("should stop leasing once closed")
    void shouldStopWhenClosed() {
        PoolLease lease = pool.tryAcquire("a", "r1").orElseThrow();

        pool.close();

        assertThat(pool.isAvailable()).isFalse();
        assertThat(pool.tryAcquire("a", "r2")).isEmpty();
        // Outstanding leases can still be returned
        pool.release(lease);
        assertThat(pool.capacity().used()).isZero();
    }

    @Test
    @DisplayName("should reject a non-positive capacity")
    void shouldRejectBadCapacity() {
        assertThatThrownBy(() -> new SlotResourcePool(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should never over-lease under concurrency")
    void shouldBeThreadSafe() throws InterruptedException {
        SlotResourcePool shared = new SlotResourcePool("shared", 3);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch latch = new CountDownLatch(threads);
        AtomicInteger maxSeen = new AtomicInteger();
        Set<String> heldSlots = ConcurrentHashMap.newKeySet();
        AtomicInteger collisions = new AtomicInteger();

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 500; i++) {
                        Optional<PoolLease> lease = shared.tryAcquire("t", "r");
                        if (lease.isPresent()) {
                            maxSeen.accumulateAndGet(shared.capacity().used(), Math::max);
                            if (!heldSlots.add(lease.get().resourceId())) {
                                collisions.incrementAndGet();
                            }
                            heldSlots.remove(lease.get().resourceId());
                            shared.release(lease.get());
                        }
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(maxSeen.get()).isLessThanOrEqualTo(3);
        assertThat(collisions.get()).isZero();
        assertThat(shared.capacity().used()).isZero();
    }
}
