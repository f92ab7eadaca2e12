package fr.lapetina.tenantserving.infrastructure.config;

import fr.lapetina.tenantserving.domain.model.TenantPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the admission layer.
 * Designed to be populated from YAML.
 */
public class ServingConfig {

    private ServerConfig server = new ServerConfig();
    private PoolConfig pool = new PoolConfig();
    private AdmissionConfig admission = new AdmissionConfig();
    private List<TenantConfig> tenants = new ArrayList<>();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public AdmissionConfig getAdmission() { return admission; }
    public void setAdmission(AdmissionConfig admission) { this.admission = admission; }

    public List<TenantConfig> getTenants() { return tenants; }
    public void setTenants(List<TenantConfig> tenants) { this.tenants = tenants; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Builds the tenant policy table, each entry completed from the default policy.
     *
     * @throws ConfigLoader.ConfigurationException on a missing id, a duplicate id or an invalid value
     */
    public Map<String, TenantPolicy> tenantPolicies() {
        TenantPolicy defaults = admission.getDefaultPolicy().toPolicy(TenantPolicy.defaults());
        Map<String, TenantPolicy> policies = new LinkedHashMap<>();
        for (TenantConfig tenant : tenants) {
            if (tenant.getId() == null || tenant.getId().isBlank()) {
                throw new ConfigLoader.ConfigurationException("Tenant entry without id");
            }
            if (policies.containsKey(tenant.getId())) {
                throw new ConfigLoader.ConfigurationException("Duplicate tenant id: " + tenant.getId());
            }
            policies.put(tenant.getId(), tenant.toPolicy(defaults));
        }
        return policies;
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private boolean enabled = true;
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 4;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Resource pool configuration. {@code slots} is a plain counter of capacity units,
     * {@code nodes} spreads leases over worker nodes.
     */
    public static class PoolConfig {
        private String type = "slots";
        private String name = "pool";
        private int capacity = 8;
        private List<NodeConfig> nodes = new ArrayList<>();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }

        public List<NodeConfig> getNodes() { return nodes; }
        public void setNodes(List<NodeConfig> nodes) { this.nodes = nodes; }
    }

    /**
     * Individual worker node configuration.
     */
    public static class NodeConfig {
        private String id;
        private int maxConcurrent = 4;
        private int weight = 1;
        private boolean enabled = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Admission pipeline configuration.
     */
    public static class AdmissionConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long sweepIntervalMs = 50;
        private boolean strictRegistration = false;
        private PolicyConfig defaultPolicy = new PolicyConfig();

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }

        public boolean isStrictRegistration() { return strictRegistration; }
        public void setStrictRegistration(boolean strictRegistration) { this.strictRegistration = strictRegistration; }

        public PolicyConfig getDefaultPolicy() { return defaultPolicy; }
        public void setDefaultPolicy(PolicyConfig defaultPolicy) { this.defaultPolicy = defaultPolicy; }
    }

    /**
     * Policy fields. Unset fields take the value of the policy passed to {@link #toPolicy}.
     * A missing {@code ratePerSecond} means unlimited.
     */
    public static class PolicyConfig {
        private Integer weight;
        private Integer maxConcurrent;
        private Double ratePerSecond;
        private Double burst;
        private Long maxWaitMs;
        private Boolean queueOnRateLimit;

        public Integer getWeight() { return weight; }
        public void setWeight(Integer weight) { this.weight = weight; }

        public Integer getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(Integer maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public Double getRatePerSecond() { return ratePerSecond; }
        public void setRatePerSecond(Double ratePerSecond) { this.ratePerSecond = ratePerSecond; }

        public Double getBurst() { return burst; }
        public void setBurst(Double burst) { this.burst = burst; }

        public Long getMaxWaitMs() { return maxWaitMs; }
        public void setMaxWaitMs(Long maxWaitMs) { this.maxWaitMs = maxWaitMs; }

        public Boolean getQueueOnRateLimit() { return queueOnRateLimit; }
        public void setQueueOnRateLimit(Boolean queueOnRateLimit) { this.queueOnRateLimit = queueOnRateLimit; }

        public TenantPolicy toPolicy(TenantPolicy base) {
            TenantPolicy.Builder builder = base.toBuilder();
            if (weight != null) {
                builder.weight(weight);
            }
            if (maxConcurrent != null) {
                builder.maxConcurrent(maxConcurrent);
            }
            if (ratePerSecond != null) {
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
            try {
                return builder.build();
            } catch (IllegalArgumentException e) {
                throw new ConfigLoader.ConfigurationException("Invalid policy: " + e.getMessage(), e);
            }
        }
    }

    /**
     * A tenant entry: an id plus its policy fields.
     */
    public static class TenantConfig extends PolicyConfig {
        private String id;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "tenant_serving";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
