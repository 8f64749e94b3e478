package org.fairshare.assignment.policy;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of relocation policies by id.
 *
 * <p>Every registry carries the two built-ins, {@code LEAST_LOADED} and
 * {@code ROUND_ROBIN}. Callers may add their own policies; a custom policy whose id
 * matches a built-in replaces it. A missing or blank id in a lookup resolves to
 * {@code LEAST_LOADED}.</p>
 */
public final class RelocationPolicyRegistry {
    public static final String POLICY_LEAST_LOADED = "LEAST_LOADED";
    public static final String POLICY_ROUND_ROBIN = "ROUND_ROBIN";
    public static final String DEFAULT_POLICY_ID = POLICY_LEAST_LOADED;

    private static final RelocationPolicyRegistry DEFAULT = new RelocationPolicyRegistry(List.of());

    private final Map<String, RelocationPolicy> policiesById;

    /**
     * Creates a registry holding the built-ins plus {@code customPolicies}.
     *
     * @param customPolicies additional or overriding policies, in registration order.
     * @throws IllegalArgumentException when a custom policy has a blank id.
     */
    public RelocationPolicyRegistry(Collection<? extends RelocationPolicy> customPolicies) {
        Objects.requireNonNull(customPolicies, "customPolicies");
        LinkedHashMap<String, RelocationPolicy> byId = new LinkedHashMap<>();
        byId.put(POLICY_LEAST_LOADED, new LeastLoadedRelocationPolicy());
        byId.put(POLICY_ROUND_ROBIN, new RoundRobinRelocationPolicy());
        for (RelocationPolicy policy : customPolicies) {
            Objects.requireNonNull(policy, "policy");
            String id = Objects.requireNonNull(policy.id(), "policy.id").trim();
            if (id.isEmpty()) {
                throw new IllegalArgumentException("relocation policy id must be non-blank");
            }
            byId.put(id, policy);
        }
        this.policiesById = Collections.unmodifiableMap(byId);
    }

    /**
     * Returns the shared registry with built-in policies only.
     */
    public static RelocationPolicyRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * Maps a configured policy id to its lookup key: trimmed, with a missing or blank
     * id standing for {@link #DEFAULT_POLICY_ID}.
     */
    public static String resolveId(String policyId) {
        if (policyId == null || policyId.isBlank()) {
            return DEFAULT_POLICY_ID;
        }
        return policyId.trim();
    }

    /**
     * Finds the policy registered under {@link #resolveId(String) resolveId(policyId)}.
     */
    public Optional<RelocationPolicy> find(String policyId) {
        return Optional.ofNullable(policiesById.get(resolveId(policyId)));
    }

    /**
     * Returns the policy used when no id is configured.
     */
    public RelocationPolicy defaultPolicy() {
        return policiesById.get(DEFAULT_POLICY_ID);
    }

    /**
     * Returns registered ids in registration order, built-ins first.
     */
    public Set<String> policyIds() {
        return policiesById.keySet();
    }
}
