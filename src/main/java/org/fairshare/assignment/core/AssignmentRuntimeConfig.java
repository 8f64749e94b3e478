package org.fairshare.assignment.core;

import lombok.Builder;
import lombok.Value;
import org.fairshare.assignment.policy.RelocationPolicyRegistry;

/**
 * Runtime configuration bound once when an {@link AssignmentCore} is created.
 */
@Value
@Builder
public class AssignmentRuntimeConfig {

    /**
     * Selected relocation policy id. Blank or {@code null} selects {@code LEAST_LOADED}.
     */
    String relocationPolicyId;

    /**
     * Whether every produced plan is checked against the plan invariants.
     * {@code null} means enabled.
     */
    Boolean verifyInvariants;

    /**
     * Returns the effective invariant-verification flag.
     */
    public boolean verifyInvariantsEnabled() {
        return verifyInvariants == null || verifyInvariants;
    }

    /**
     * Returns convenience runtime config with all defaults.
     */
    public static AssignmentRuntimeConfig defaults() {
        return leastLoaded();
    }

    /**
     * Returns convenience runtime config for {@code LEAST_LOADED} relocation.
     */
    public static AssignmentRuntimeConfig leastLoaded() {
        return AssignmentRuntimeConfig.builder()
                .relocationPolicyId(RelocationPolicyRegistry.POLICY_LEAST_LOADED)
                .build();
    }

    /**
     * Returns convenience runtime config for {@code ROUND_ROBIN} relocation.
     */
    public static AssignmentRuntimeConfig roundRobin() {
        return AssignmentRuntimeConfig.builder()
                .relocationPolicyId(RelocationPolicyRegistry.POLICY_ROUND_ROBIN)
                .build();
    }
}
