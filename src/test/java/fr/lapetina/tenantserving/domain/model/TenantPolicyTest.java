package fr.lapetina.tenantserving.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TenantPolicyTest {

    @Test
    @DisplayName("should provide documented defaults")
    void shouldProvideDefaults() {
        TenantPolicy policy = TenantPolicy.defaults();

        assertThat(policy.weight()).isEqualTo(1);
        assertThat(policy.maxConcurrent()).isEqualTo(10);
        assertThat(policy.isRateUnlimited()).isTrue();
        assertThat(policy.burst()).isEqualTo(1.0);
        assertThat(policy.maxWait()).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.queueOnRateLimit()).isFalse();
    }

    @Test
    @DisplayName("should copy every field through toBuilder")
    void shouldRoundTripBuilder() {
        TenantPolicy policy = TenantPolicy.builder()
                .weight(3)
                .maxConcurrent(2)
                .ratePerSecond(5.0)
                .burst(10.0)
                .maxWait(Duration.ofMillis(250))
                .queueOnRateLimit(true)
                .build();

        assertThat(policy.toBuilder().build()).isEqualTo(policy);
        assertThat(policy.toBuilder().unlimitedRate().build().isRateUnlimited()).isTrue();
    }

    @Test
    @DisplayName("should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> TenantPolicy.builder().weight(0).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("weight");
        assertThatThrownBy(() -> TenantPolicy.builder().maxConcurrent(0).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxConcurrent");
        assertThatThrownBy(() -> TenantPolicy.builder().ratePerSecond(0).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("ratePerSecond");
        assertThatThrownBy(() -> TenantPolicy.builder().burst(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("burst");
        assertThatThrownBy(() -> TenantPolicy.builder().maxWait(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxWait");
        assertThatThrownBy(() -> TenantPolicy.builder().maxWait(null).build())
                .isInstanceOf(NullPointerException.class);
    }
}
