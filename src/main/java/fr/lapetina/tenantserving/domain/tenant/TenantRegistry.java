package fr.lapetina.tenantserving.domain.tenant;

import fr.lapetina.tenantserving.domain.model.TenantPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of tenants and their admission policies.
 *
 * Policies are immutable snapshots stored in a concurrent map: a lookup racing with
 * an update reads either the old or the new policy, never a mix of fields.
 * Unknown tenants resolve to the default policy.
 *
 * The registry also owns the per-tenant runtime records ({@link TenantState}),
 * created on first use and never removed.
 */
public final class TenantRegistry {

    private static final Logger log = LoggerFactory.getLogger(TenantRegistry.class);

    private final Map<String, TenantPolicy> policies = new ConcurrentHashMap<>();
    private final Map<String, TenantState> states = new ConcurrentHashMap<>();
    private final List<Consumer<TenantRegistryEvent>> listeners = new CopyOnWriteArrayList<>();
    private volatile TenantPolicy defaultPolicy;

    public TenantRegistry() {
        this(TenantPolicy.defaults());
    }

    public TenantRegistry(TenantPolicy defaultPolicy) {
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "Default policy is required");
    }

    /**
     * Registers a tenant, or replaces the policy of an already registered one.
     */
    public void register(String tenantId, TenantPolicy policy) {
        requireTenantId(tenantId);
        Objects.requireNonNull(policy, "Policy is required");

        TenantPolicy previous = policies.put(tenantId, policy);
        stateOf(tenantId);
        if (previous == null) {
            log.info("Tenant registered: tenantId={}, policy={}", tenantId, policy);
            notifyListeners(new TenantRegistryEvent(TenantRegistryEvent.Type.ADDED, tenantId, policy));
        } else if (!previous.equals(policy)) {
            log.info("Tenant policy updated: tenantId={}, {} -> {}", tenantId, previous, policy);
            notifyListeners(new TenantRegistryEvent(TenantRegistryEvent.Type.UPDATED, tenantId, policy));
        }
    }

    /**
     * Replaces a tenant's policy. Applies to later admission decisions only.
     * An unknown tenant becomes registered.
     */
    public void update(String tenantId, TenantPolicy policy) {
        register(tenantId, policy);
    }

    /**
     * Returns the tenant's policy, or the default policy when the tenant is unknown.
     */
    public TenantPolicy lookup(String tenantId) {
        TenantPolicy policy = policies.get(tenantId);
        return policy != null ? policy : defaultPolicy;
    }

    public Optional<TenantPolicy> find(String tenantId) {
        return Optional.ofNullable(policies.get(tenantId));
    }

    public boolean isRegistered(String tenantId) {
        return policies.containsKey(tenantId);
    }

    public TenantPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    public void setDefaultPolicy(TenantPolicy policy) {
        TenantPolicy previous = this.defaultPolicy;
        this.defaultPolicy = Objects.requireNonNull(policy, "Default policy is required");
        if (!previous.equals(policy)) {
            log.info("Default policy changed: {} -> {}", previous, policy);
        }
    }

    /**
     * Returns the runtime record of a tenant, creating it on first use.
     * Unregistered tenants get a record too; they still resolve to the default policy.
     */
    public TenantState stateOf(String tenantId) {
        requireTenantId(tenantId);
        TenantState existing = states.get(tenantId);
        if (existing != null) {
            return existing;
        }
        TenantState created = new TenantState(tenantId);
        TenantState raced = states.putIfAbsent(tenantId, created);
        if (raced != null) {
            return raced;
        }
        log.debug("Tenant state created: tenantId={}", tenantId);
        if (!policies.containsKey(tenantId)) {
            notifyListeners(new TenantRegistryEvent(TenantRegistryEvent.Type.OBSERVED, tenantId, defaultPolicy));
        }
        return created;
    }

    /**
     * Returns the runtime record of a tenant if one exists, without creating it.
     */
    public Optional<TenantState> findState(String tenantId) {
        return tenantId == null ? Optional.empty() : Optional.ofNullable(states.get(tenantId));
    }

    /**
     * Registered tenants and their policies, sorted by tenant ID.
     */
    public SortedMap<String, TenantPolicy> tenants() {
        return new TreeMap<>(policies);
    }

    /**
     * Every tenant with runtime state, registered or merely observed.
     */
    public Collection<TenantState> states() {
        return new ArrayList<>(states.values());
    }

    /**
     * Applies a configuration reload: registers or updates every tenant of the new set.
     * Tenants missing from the new set keep their policy; tenants are never implicitly deleted.
     */
    public void replaceAll(Map<String, TenantPolicy> newPolicies) {
        for (Map.Entry<String, TenantPolicy> entry : newPolicies.entrySet()) {
            register(entry.getKey(), entry.getValue());
        }

        long kept = policies.keySet().stream()
                .filter(id -> !newPolicies.containsKey(id))
                .count();
        if (kept > 0) {
            log.info("Tenants absent from new configuration keep their policy: count={}", kept);
        }
        log.info("Tenant registry reloaded: {} tenants registered", policies.size());
    }

    public void addListener(Consumer<TenantRegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<TenantRegistryEvent> listener) {
        listeners.remove(listener);
    }

    public int size() {
        return policies.size();
    }

    private void notifyListeners(TenantRegistryEvent event) {
        for (Consumer<TenantRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    private static void requireTenantId(String tenantId) {
        Objects.requireNonNull(tenantId, "Tenant ID is required");
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant ID must not be blank");
        }
    }

    /**
     * Event for tenant registry changes.
     * OBSERVED is raised when an unregistered tenant sends its first request.
     */
    public record TenantRegistryEvent(Type type, String tenantId, TenantPolicy policy) {
        public enum Type {
            ADDED,
            UPDATED,
            OBSERVED
        }
    }
}
