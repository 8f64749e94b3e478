package org.fairshare.assignment.core;

import lombok.Builder;
import org.fairshare.assignment.event.Event;
import org.fairshare.assignment.model.Order;
import org.fairshare.assignment.model.Plan;
import org.fairshare.assignment.model.Rider;
import org.fairshare.assignment.policy.RelocationPolicy;
import org.fairshare.assignment.policy.RelocationPolicyRegistry;
import org.fairshare.assignment.session.AssignmentSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Main assignment entry point.
 *
 * <p>The facade binds one runtime configuration at construction time and then
 * serves stateless calls. Execution flow:</p>
 * <ul>
 * <li>Resolve the relocation policy from the registry once.</li>
 * <li>Delegate plan construction to {@link PlanBuilder} and event application to
 *     {@link EventProcessor}.</li>
 * <li>When enabled, verify every produced plan with {@link PlanInvariants}.</li>
 * </ul>
 *
 * <p>Calls are pure with respect to their inputs and the facade holds no mutable
 * state, so one instance may be shared across threads. Successive events against one
 * live plan must still be applied in order; see {@link AssignmentSession}.</p>
 */
public final class AssignmentCore implements AssignmentService {
    public static final String REASON_EMPTY_RIDER_SET = "EMPTY_RIDER_SET";
    public static final String REASON_NO_ALTERNATE_RIDER = "NO_ALTERNATE_RIDER";
    public static final String REASON_RIDERS_REQUIRED = "RIDERS_REQUIRED";
    public static final String REASON_ORDERS_REQUIRED = "ORDERS_REQUIRED";
    public static final String REASON_PLAN_REQUIRED = "PLAN_REQUIRED";
    public static final String REASON_EVENT_REQUIRED = "EVENT_REQUIRED";
    public static final String REASON_RELOCATION_CONFIG_REQUIRED = "RELOCATION_CONFIG_REQUIRED";
    public static final String REASON_UNKNOWN_RELOCATION_POLICY = "UNKNOWN_RELOCATION_POLICY";
    public static final String REASON_INVALID_RELOCATION_TARGET = "INVALID_RELOCATION_TARGET";
    public static final String REASON_INVARIANT_VIOLATION = "INVARIANT_VIOLATION";

    private static final Logger log = LoggerFactory.getLogger(AssignmentCore.class);

    private final PlanBuilder planBuilder;
    private final EventProcessor eventProcessor;
    private final boolean verifyInvariants;

    /**
     * Creates the assignment facade.
     *
     * @param runtimeConfig runtime configuration; required.
     * @param relocationPolicyRegistry optional registry override (defaults to built-ins).
     * @throws AssignmentException when the config is missing or names an unknown policy.
     */
    @Builder
    public AssignmentCore(AssignmentRuntimeConfig runtimeConfig, RelocationPolicyRegistry relocationPolicyRegistry) {
        if (runtimeConfig == null) {
            throw new AssignmentException(
                    REASON_RELOCATION_CONFIG_REQUIRED,
                    "assignment runtime config must be provided"
            );
        }
        RelocationPolicyRegistry registry = relocationPolicyRegistry == null
                ? RelocationPolicyRegistry.defaultRegistry()
                : relocationPolicyRegistry;
        String policyId = RelocationPolicyRegistry.resolveId(runtimeConfig.getRelocationPolicyId());
        RelocationPolicy policy = registry.find(policyId).orElseThrow(() -> new AssignmentException(
                REASON_UNKNOWN_RELOCATION_POLICY,
                "unknown relocation policy id: " + policyId + " (registered: " + registry.policyIds() + ")"
        ));
        this.planBuilder = new PlanBuilder();
        this.eventProcessor = new EventProcessor(policy);
        this.verifyInvariants = runtimeConfig.verifyInvariantsEnabled();
        log.info("Assignment core bound: relocationPolicy={}, verifyInvariants={}", policy.id(), verifyInvariants);
    }

    /**
     * Creates a facade with {@link AssignmentRuntimeConfig#defaults()}.
     */
    public static AssignmentCore withDefaults() {
        return AssignmentCore.builder().runtimeConfig(AssignmentRuntimeConfig.defaults()).build();
    }

    /**
     * Returns the id of the bound relocation policy.
     */
    public String relocationPolicyId() {
        return eventProcessor.relocationPolicy().id();
    }

    @Override
    public Plan build(List<Rider> riders, List<Order> orders) {
        Plan plan = planBuilder.build(riders, orders);
        if (verifyInvariants) {
            PlanInvariants.verifyBuilt(plan);
        }
        log.info("Built plan: riders={}, orders={}", plan.riderCount(), plan.totalOrders());
        return plan;
    }

    @Override
    public Plan apply(Plan plan, Event event) {
        return process(plan, event).plan();
    }

    @Override
    public EventResult process(Plan plan, Event event) {
        EventResult result;
        try {
            result = eventProcessor.process(plan, event);
        } catch (AssignmentException ex) {
            log.warn("Event {} rejected: {}", event, ex.getMessage());
            throw ex;
        }
        if (verifyInvariants) {
            PlanInvariants.verifyTransition(plan, result);
        }
        return result;
    }

    /**
     * Opens a serialized event session over {@code initialPlan} backed by this facade.
     */
    public AssignmentSession openSession(Plan initialPlan) {
        return new AssignmentSession(this, initialPlan, relocationPolicyId());
    }
}
