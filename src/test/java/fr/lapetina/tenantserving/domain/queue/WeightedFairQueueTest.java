package fr.lapetina.tenantserving.domain.queue;

import fr.lapetina.tenantserving.domain.model.TenantPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class WeightedFairQueueTest {

    private static final TenantPolicy WEIGHT_1 = TenantPolicy.builder().weight(1).build();
    private static final TenantPolicy WEIGHT_2 = TenantPolicy.builder().weight(2).build();
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private WeightedFairQueue<String> queue;

    @BeforeEach
    void setUp() {
        queue = new WeightedFairQueue<>();
    }

    private FairQueueEntry<String> enqueue(String tenant, TenantPolicy policy, String payload) {
        return queue.enqueue(tenant, 1.0, policy, NO_DEADLINE, false, payload);
    }

    private List<String> drainOrder() {
        List<String> order = new ArrayList<>();
        Optional<FairQueueEntry<String>> next;
        while ((next = queue.dequeue()).isPresent()) {
            order.add(next.get().getPayload());
        }
        return order;
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("should serve a single tenant in FIFO order")
        void shouldServeSingleTenantFifo() {
            for (int i = 0; i < 5; i++) {
                enqueue("a", WEIGHT_1, "a" + i);
            }

            assertThat(drainOrder()).containsExactly("a0", "a1", "a2", "a3", "a4");
        }

        @Test
        @DisplayName("should interleave 2:1 for weights 2 and 1")
        void shouldInterleaveByWeight() {
            for (int i = 0; i < 6; i++) {
                enqueue("a", WEIGHT_2, "A");
            }
            for (int i = 0; i < 3; i++) {
                enqueue("b", WEIGHT_1, "B");
            }

            // vft A: 0.5, 1.0, 1.5, 2.0, 2.5, 3.0 / B: 1.0, 2.0, 3.0; ties go to the earlier arrival
            assertThat(drainOrder()).containsExactly("A", "A", "B", "A", "A", "B", "A", "A", "B");
        }

        @Test
        @DisplayName("should alternate between equal-weight tenants")
        void shouldAlternateEqualWeights() {
            for (int i = 0; i < 3; i++) {
                enqueue("a", WEIGHT_1, "a" + i);
            }
            for (int i = 0; i < 3; i++) {
                enqueue("b", WEIGHT_1, "b" + i);
            }

            assertThat(drainOrder()).containsExactly("a0", "b0", "a1", "b1", "a2", "b2");
        }

        @Test
        @DisplayName("should not let an idle tenant bank credit")
        void shouldNotBankCreditWhileIdle() {
            for (int i = 0; i < 4; i++) {
                enqueue("busy", WEIGHT_1, "busy" + i);
            }
            queue.dequeue();
            queue.dequeue();
            queue.dequeue();

            // Virtual time is now 3; the newcomer starts from there, not from 0
            FairQueueEntry<String> late = enqueue("idle", WEIGHT_1, "idle0");

            assertThat(late.getVirtualFinishTime()).isEqualTo(4.0);
            assertThat(drainOrder()).containsExactly("busy3", "idle0");
        }

        @Test
        @DisplayName("should weigh entries by cost")
        void shouldWeighByCost() {
            FairQueueEntry<String> heavy = queue.enqueue("a", 4.0, WEIGHT_1, NO_DEADLINE, false, "heavy");
            FairQueueEntry<String> light = queue.enqueue("b", 1.0, WEIGHT_1, NO_DEADLINE, false, "light");

            assertThat(heavy.getVirtualFinishTime()).isEqualTo(4.0);
            assertThat(light.getVirtualFinishTime()).isEqualTo(1.0);
            assertThat(drainOrder()).containsExactly("light", "heavy");
        }

        @Test
        @DisplayName("should advance virtual time on dequeue")
        void shouldAdvanceVirtualTime() {
            enqueue("a", WEIGHT_2, "a0");

            assertThat(queue.virtualTime()).isZero();
            queue.dequeue();
            assertThat(queue.virtualTime()).isEqualTo(0.5);
        }
    }

    @Nested
    @DisplayName("Eligibility")
    class Eligibility {

        @Test
        @DisplayName("should skip ineligible tenants without reordering them")
        void shouldSkipIneligible() {
            enqueue("a", WEIGHT_1, "a0");
            enqueue("a", WEIGHT_1, "a1");
            enqueue("b", WEIGHT_1, "b0");

            Optional<FairQueueEntry<String>> served = queue.dequeue(e -> !e.getTenantId().equals("a"));

            assertThat(served).map(FairQueueEntry::getPayload).contains("b0");
            assertThat(drainOrder()).containsExactly("a0", "a1");
        }

        @Test
        @DisplayName("should return empty when nothing is eligible")
        void shouldReturnEmptyWhenNothingEligible() {
            enqueue("a", WEIGHT_1, "a0");

            assertThat(queue.dequeue(e -> false)).isEmpty();
            assertThat(queue.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should expose only one head per tenant, in service order")
        void shouldExposeHeads() {
            enqueue("a", WEIGHT_1, "a0");
            enqueue("a", WEIGHT_1, "a1");
            enqueue("b", WEIGHT_2, "b0");

            assertThat(queue.heads()).extracting(FairQueueEntry::getPayload).containsExactly("b0", "a0");
        }

        @Test
        @DisplayName("should take a specific head once")
        void shouldTakeOnce() {
            FairQueueEntry<String> entry = enqueue("a", WEIGHT_1, "a0");

            assertThat(queue.take(entry)).isTrue();
            assertThat(queue.take(entry)).isFalse();
            assertThat(queue.virtualTime()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Removal")
    class Removal {

        @Test
        @DisplayName("should remove exactly the given entry")
        void shouldRemoveExactEntry() {
            enqueue("a", WEIGHT_1, "a0");
            FairQueueEntry<String> middle = enqueue("a", WEIGHT_1, "a1");
            enqueue("a", WEIGHT_1, "a2");

            assertThat(queue.remove(middle)).isTrue();
            assertThat(queue.remove(middle)).isFalse();
            assertThat(queue.size("a")).isEqualTo(2);
            assertThat(drainOrder()).containsExactly("a0", "a2");
        }

        @Test
        @DisplayName("should promote the next entry when a head is removed")
        void shouldPromoteNextHead() {
            FairQueueEntry<String> head = enqueue("a", WEIGHT_1, "a0");
            enqueue("a", WEIGHT_1, "a1");

            queue.remove(head);

            assertThat(queue.heads()).extracting(FairQueueEntry::getPayload).containsExactly("a1");
        }

        @Test
        @DisplayName("should remove expired entries only")
        void shouldRemoveExpired() {
            queue.enqueue("a", 1.0, WEIGHT_1, 100, false, "early");
            queue.enqueue("a", 1.0, WEIGHT_1, 300, false, "late");
            queue.enqueue("b", 1.0, WEIGHT_1, 100, false, "b-early");

            List<FairQueueEntry<String>> expired = queue.removeExpired(200);

            assertThat(expired).extracting(FairQueueEntry::getPayload)
                    .containsExactlyInAnyOrder("early", "b-early");
            assertThat(drainOrder()).containsExactly("late");
        }

        @Test
        @DisplayName("should not expire an entry exactly at its deadline")
        void shouldNotExpireAtDeadline() {
            queue.enqueue("a", 1.0, WEIGHT_1, 100, false, "a0");

            assertThat(queue.removeExpired(100)).isEmpty();
            assertThat(queue.removeExpired(101)).hasSize(1);
        }

        @Test
        @DisplayName("should drain everything in service order")
        void shouldDrainAll() {
            enqueue("a", WEIGHT_1, "a0");
            enqueue("b", WEIGHT_2, "b0");
            enqueue("a", WEIGHT_1, "a1");

            List<FairQueueEntry<String>> all = queue.drainAll();

            assertThat(all).extracting(FairQueueEntry::getPayload).containsExactly("b0", "a0", "a1");
            assertThat(queue.isEmpty()).isTrue();
            assertThat(queue.size("a")).isZero();
        }
    }
}
