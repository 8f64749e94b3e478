package org.fairshare.assignment.core;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import org.fairshare.assignment.event.Event;
import org.fairshare.assignment.event.OrderCanceled;
import org.fairshare.assignment.event.RiderRejected;
import org.fairshare.assignment.model.Plan;
import org.fairshare.assignment.policy.RelocationPolicy;
import org.fairshare.assignment.policy.RelocationPolicyRegistry;
import org.fairshare.assignment.testutil.AssignmentFixtureFactory;
import org.fairshare.assignment.testutil.IndexedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AssignmentCore Tests")
class AssignmentCoreTest {

    @Test
    @DisplayName("Validation: runtime config must be provided")
    void testRuntimeConfigRequired() {
        AssignmentException ex = assertThrows(
                AssignmentException.class,
                () -> AssignmentCore.builder().build()
        );
        assertEquals(AssignmentCore.REASON_RELOCATION_CONFIG_REQUIRED, ex.getReasonCode());
    }

    @Test
    @DisplayName("Validation: unknown relocation policy is rejected deterministically")
    void testUnknownPolicyRejected() {
        AssignmentException ex = assertThrows(
                AssignmentException.class,
                () -> AssignmentCore.builder()
                        .runtimeConfig(AssignmentRuntimeConfig.builder().relocationPolicyId("NEAREST").build())
                        .build()
        );
        assertEquals(AssignmentCore.REASON_UNKNOWN_RELOCATION_POLICY, ex.getReasonCode());
        assertTrue(ex.getMessage().startsWith("[" + AssignmentCore.REASON_UNKNOWN_RELOCATION_POLICY + "] "));
    }

    @Test
    @DisplayName("Blank policy id binds the least-loaded default")
    void testBlankPolicyDefaults() {
        AssignmentCore core = AssignmentCore.builder()
                .runtimeConfig(AssignmentRuntimeConfig.builder().relocationPolicyId("  ").build())
                .build();
        assertEquals(RelocationPolicyRegistry.POLICY_LEAST_LOADED, core.relocationPolicyId());
        assertEquals(RelocationPolicyRegistry.POLICY_LEAST_LOADED, AssignmentCore.withDefaults().relocationPolicyId());
    }

    @Test
    @DisplayName("Round robin config binds the round robin policy")
    void testRoundRobinConfig() {
        AssignmentCore core = AssignmentCore.builder()
                .runtimeConfig(AssignmentRuntimeConfig.roundRobin())
                .build();
        assertEquals(RelocationPolicyRegistry.POLICY_ROUND_ROBIN, core.relocationPolicyId());

        Plan plan = core.build(AssignmentFixtureFactory.scenarioRiders(), AssignmentFixtureFactory.scenarioOrders());
        Plan next = core.apply(plan, Event.riderRejected(1, 10L));
        assertEquals(List.of(20L, 50L, 10L), next.asMap().get(2));
    }

    @Test
    @DisplayName("End-to-end scenario through the facade")
    void testScenario() {
        AssignmentCore core = AssignmentCore.withDefaults();
        Plan plan = core.build(AssignmentFixtureFactory.scenarioRiders(), AssignmentFixtureFactory.scenarioOrders());
        plan = core.apply(plan, Event.riderRejected(1, 10L));
        plan = core.apply(plan, Event.orderCanceled(50L));
        assertEquals(Map.of(1, List.of(40L), 2, List.of(20L), 3, List.of(30L, 10L)), plan.asMap());
    }

    @Test
    @DisplayName("Empty rider set surfaces through the facade")
    void testEmptyRiderSet() {
        AssignmentException ex = assertThrows(
                AssignmentException.class,
                () -> AssignmentCore.withDefaults().build(List.of(), AssignmentFixtureFactory.orders(1L))
        );
        assertEquals(AssignmentCore.REASON_EMPTY_RIDER_SET, ex.getReasonCode());
    }

    @Test
    @DisplayName("Custom policy returning the rejecting rider is refused")
    void testInvalidCustomPolicyTarget() {
        RelocationPolicy selfish = new RelocationPolicy() {
            @Override
            public String id() {
                return "SELFISH";
            }

            @Override
            public int selectTarget(Plan plan, int rejectingRiderId) {
                return rejectingRiderId;
            }
        };
        AssignmentCore core = AssignmentCore.builder()
                .runtimeConfig(AssignmentRuntimeConfig.builder().relocationPolicyId("SELFISH").build())
                .relocationPolicyRegistry(new RelocationPolicyRegistry(List.of(selfish)))
                .build();
        Plan plan = core.build(AssignmentFixtureFactory.scenarioRiders(), AssignmentFixtureFactory.scenarioOrders());

        AssignmentException ex = assertThrows(
                AssignmentException.class,
                () -> core.apply(plan, Event.riderRejected(1, 10L))
        );
        assertEquals(AssignmentCore.REASON_INVALID_RELOCATION_TARGET, ex.getReasonCode());
    }

    @Test
    @DisplayName("Invariant verification can be disabled")
    void testVerificationDisabled() {
        AssignmentCore core = AssignmentCore.builder()
                .runtimeConfig(AssignmentRuntimeConfig.builder().verifyInvariants(false).build())
                .build();
        assertFalse(core.build(AssignmentFixtureFactory.riders(1), List.of()).containsRider(2));
        assertTrue(AssignmentRuntimeConfig.defaults().verifyInvariantsEnabled());
        assertFalse(AssignmentRuntimeConfig.builder().verifyInvariants(false).build().verifyInvariantsEnabled());
    }

    @Test
    @DisplayName("Randomized event streams conserve orders across rejections and cancellations")
    void testEventsOverTime() {
        AssignmentCore core = AssignmentCore.withDefaults();
        Random random = new Random(2024);
        for (int round = 0; round < 200; round++) {
            Plan starting = AssignmentFixtureFactory.randomStartingPlan(random, 2 + random.nextInt(10), 5);
            List<Event> events = IndexedEvent.resolveAll(
                    IndexedEvent.randomScript(random, random.nextInt(40)),
                    starting
            );

            LongSet canceled = new LongOpenHashSet();
            for (Event event : events) {
                if (event instanceof OrderCanceled) {
                    canceled.add(((OrderCanceled) event).orderId());
                }
            }

            Plan current = starting;
            for (Event event : events) {
                Plan before = current;
                current = core.apply(current, event);
                if (event instanceof RiderRejected) {
                    RiderRejected rejected = (RiderRejected) event;
                    assertTrue(PlanInvariants.conservesOrders(before, current));
                    assertFalse(current.orders(rejected.riderId()).contains(rejected.orderId()));
                }
            }

            LongSet remaining = new LongOpenHashSet(current.sortedOrderIds());
            for (long orderId : canceled.toLongArray()) {
                assertFalse(remaining.contains(orderId));
            }
            LongSet union = new LongOpenHashSet(remaining);
            union.addAll(canceled);
            assertEquals(new LongOpenHashSet(starting.sortedOrderIds()), union);
        }
    }
}
