package fr.lapetina.tenantserving.domain.limit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TokenBucketTest {

    private static final long SECOND = 1_000_000_000L;

    private TokenBucket bucket;

    @BeforeEach
    void setUp() {
        bucket = new TokenBucket();
    }

    @Test
    @DisplayName("should start full")
    void shouldStartFull() {
        assertThat(bucket.available(1.0, 5.0, 0)).isEqualTo(5.0);
    }

    @Test
    @DisplayName("should consume up to the burst then refuse")
    void shouldConsumeUpToBurst() {
        assertThat(bucket.tryConsume(1.0, 3.0, 1.0, 0)).isTrue();
        assertThat(bucket.tryConsume(1.0, 3.0, 1.0, 0)).isTrue();
        assertThat(bucket.tryConsume(1.0, 3.0, 1.0, 0)).isTrue();
        assertThat(bucket.tryConsume(1.0, 3.0, 1.0, 0)).isFalse();
    }

    @Test
    @DisplayName("should leave the balance unchanged when refusing")
    void shouldLeaveBalanceUnchangedOnRefusal() {
        bucket.tryConsume(1.0, 2.0, 1.5, 0);

        assertThat(bucket.tryConsume(1.0, 2.0, 1.0, 0)).isFalse();
        assertThat(bucket.available(1.0, 2.0, 0)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("should refill proportionally to elapsed time, capped at burst")
    void shouldRefillOverTime() {
        bucket.tryConsume(2.0, 4.0, 4.0, 0);

        assertThat(bucket.available(2.0, 4.0, SECOND / 2)).isCloseTo(1.0, within(1e-9));
        assertThat(bucket.available(2.0, 4.0, 10 * SECOND)).isEqualTo(4.0);
    }

    @Test
    @DisplayName("should not refill when the clock goes backwards")
    void shouldNotRefillBackwards() {
        bucket.tryConsume(1.0, 1.0, 1.0, 5 * SECOND);

        assertThat(bucket.tryConsume(1.0, 1.0, 1.0, 2 * SECOND)).isFalse();
        assertThat(bucket.available(1.0, 1.0, 2 * SECOND)).isZero();
    }

    @Test
    @DisplayName("should clamp the balance when the burst shrinks")
    void shouldClampOnBurstShrink() {
        assertThat(bucket.available(1.0, 10.0, 0)).isEqualTo(10.0);

        assertThat(bucket.available(1.0, 2.0, 0)).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should never pay a cost larger than the burst")
    void shouldNeverPayCostAboveBurst() {
        assertThat(bucket.tryConsume(1.0, 2.0, 3.0, 100 * SECOND)).isFalse();
        assertThat(bucket.nanosUntilAvailable(1.0, 2.0, 3.0, 100 * SECOND)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    @DisplayName("should compute time until tokens are available")
    void shouldComputeTimeUntilAvailable() {
        bucket.tryConsume(4.0, 1.0, 1.0, 0);

        assertThat(bucket.nanosUntilAvailable(4.0, 1.0, 1.0, 0)).isEqualTo(SECOND / 4);
        assertThat(bucket.nanosUntilAvailable(4.0, 1.0, 1.0, SECOND)).isZero();
    }

    @Test
    @DisplayName("should never hand out more than the burst under concurrency")
    void shouldBeThreadSafe() throws InterruptedException {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch latch = new CountDownLatch(threads);
        AtomicInteger granted = new AtomicInteger();

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 100; i++) {
                        // Frozen clock: no refill, only the initial burst can be spent
                        if (bucket.tryConsume(1.0, 50.0, 1.0, 0)) {
                            granted.incrementAndGet();
                        }
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(granted.get()).isEqualTo(50);
    }
}
