package fr.lapetina.tenantserving.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.tenantserving.domain.model.TenantPolicy;

import java.time.Duration;

/**
 * Body of {@code PUT /admin/tenants/{id}}. Missing fields keep the value of the base policy.
 * A {@code null} ratePerSecond together with {@code unlimitedRate: true} removes the rate limit.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TenantPolicyRequest {

    private Integer weight;
    private Integer maxConcurrent;
    private Double ratePerSecond;
    private Boolean unlimitedRate;
    private Double burst;
    private Long maxWaitMs;
    private Boolean queueOnRateLimit;

    // Getters and setters
    public Integer getWeight() { return weight; }
    public void setWeight(Integer weight) { this.weight = weight; }

    public Integer getMaxConcurrent() { return maxConcurrent; }
    public void setMaxConcurrent(Integer maxConcurrent) { this.maxConcurrent = maxConcurrent; }

    public Double getRatePerSecond() { return ratePerSecond; }
    public void setRatePerSecond(Double ratePerSecond) { this.ratePerSecond = ratePerSecond; }

    public Boolean getUnlimitedRate() { return unlimitedRate; }
    public void setUnlimitedRate(Boolean unlimitedRate) { this.unlimitedRate = unlimitedRate; }

    public Double getBurst() { return burst; }
    public void setBurst(Double burst) { this.burst = burst; }

    public Long getMaxWaitMs() { return maxWaitMs; }
    public void setMaxWaitMs(Long maxWaitMs) { this.maxWaitMs = maxWaitMs; }

    public Boolean getQueueOnRateLimit() { return queueOnRateLimit; }
    public void setQueueOnRateLimit(Boolean queueOnRateLimit) { this.queueOnRateLimit = queueOnRateLimit; }

    /**
     * Converts to a domain policy.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public TenantPolicy toPolicy(TenantPolicy base) {
        TenantPolicy.Builder builder = base.toBuilder();
        if (weight != null) {
            builder.weight(weight);
        }
        if (maxConcurrent != null) {
            builder.maxConcurrent(maxConcurrent);
        }
        if (Boolean.TRUE.equals(unlimitedRate)) {
            builder.unlimitedRate();
        } else if (ratePerSecond != null) {
            builder.ratePerSecond(ratePerSecond);
        }
        if (burst != null) {
            builder.burst(burst);
        }
        if (maxWaitMs != null) {
            builder.maxWait(Duration.ofMillis(maxWaitMs));
        }
        if (queueOnRateLimit != null) {
            builder.queueOnRateLimit(queueOnRateLimit);
        }
        return builder.build();
    }
}
