package org.fairshare.assignment.core;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongArrays;
import it.unimi.dsi.fastutil.longs.LongList;
import org.fairshare.assignment.model.Order;
import org.fairshare.assignment.model.Plan;
import org.fairshare.assignment.model.Rider;
import org.fairshare.assignment.testutil.AssignmentFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.fairshare.assignment.testutil.AssignmentFixtureFactory.orders;
import static org.fairshare.assignment.testutil.AssignmentFixtureFactory.riders;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PlanBuilder Tests")
class PlanBuilderTest {

    private final PlanBuilder builder = new PlanBuilder();

    @Test
    @DisplayName("Round robin over riders [1,2,3] and orders [10..50]")
    void testScenario() {
        Plan plan = builder.build(
                AssignmentFixtureFactory.scenarioRiders(),
                AssignmentFixtureFactory.scenarioOrders()
        );
        assertEquals(Map.of(1, List.of(10L, 40L), 2, List.of(20L, 50L), 3, List.of(30L)), plan.asMap());
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    @DisplayName("Empty rider set fails fast instead of looping")
    void testEmptyRiderSet() {
        AssignmentException ex = assertThrows(
                AssignmentException.class,
                () -> builder.build(List.of(), orders(1L, 2L))
        );
        assertEquals(AssignmentCore.REASON_EMPTY_RIDER_SET, ex.getReasonCode());

        AssignmentException noOrders = assertThrows(
                AssignmentException.class,
                () -> builder.build(List.of(), List.of())
        );
        assertEquals(AssignmentCore.REASON_EMPTY_RIDER_SET, noOrders.getReasonCode());
    }

    @Test
    @DisplayName("Null inputs are rejected with deterministic reason codes")
    void testNullInputs() {
        AssignmentException ridersEx = assertThrows(
                AssignmentException.class,
                () -> builder.build(null, orders(1L))
        );
        assertEquals(AssignmentCore.REASON_RIDERS_REQUIRED, ridersEx.getReasonCode());

        AssignmentException ordersEx = assertThrows(
                AssignmentException.class,
                () -> builder.build(riders(1), null)
        );
        assertEquals(AssignmentCore.REASON_ORDERS_REQUIRED, ordersEx.getReasonCode());
    }

    @Test
    @DisplayName("Fewer orders than riders leaves trailing riders empty")
    void testFewerOrdersThanRiders() {
        Plan plan = builder.build(riders(7, 8, 9, 10), orders(100L, 200L));

        assertEquals(4, plan.riderCount());
        assertEquals(LongList.of(100L), plan.orders(7));
        assertEquals(LongList.of(200L), plan.orders(8));
        assertTrue(plan.orders(9).isEmpty());
        assertTrue(plan.orders(10).isEmpty());
        assertTrue(PlanInvariants.isFair(plan));
    }

    @Test
    @DisplayName("No orders registers every rider with an empty sequence")
    void testNoOrders() {
        Plan plan = builder.build(riders(1, 2), List.of());
        assertEquals(2, plan.riderCount());
        assertEquals(0, plan.totalOrders());
    }

    @ParameterizedTest
    @CsvSource({
            "1, 1",
            "1, 9",
            "3, 3",
            "3, 10",
            "5, 23",
            "8, 64"
    })
    @DisplayName("Each rider receives floor(n/r) or one more order")
    void testShareSizes(int riderCount, int orderCount) {
        Random random = new Random(riderCount * 31L + orderCount);
        Plan plan = builder.build(
                AssignmentFixtureFactory.uniqueRiders(random, riderCount),
                AssignmentFixtureFactory.uniqueOrders(random, orderCount)
        );
        int floor = orderCount / riderCount;
        for (int i = 0; i < plan.riderIds().size(); i++) {
            int load = plan.load(plan.riderIds().getInt(i));
            assertTrue(load == floor || load == floor + 1, "load " + load + " for floor " + floor);
        }
    }

    @Test
    @DisplayName("Randomized: coverage, conservation, fairness and positional determinism")
    void testRandomizedProperties() {
        Random random = new Random(42); // Fixed seed for reproducibility
        for (int round = 0; round < 500; round++) {
            int riderCount = 1 + random.nextInt(20);
            int orderCount = riderCount + random.nextInt(60);
            List<Rider> riders = AssignmentFixtureFactory.uniqueRiders(random, riderCount);
            List<Order> orders = AssignmentFixtureFactory.uniqueOrders(random, orderCount);

            Plan plan = builder.build(riders, orders);

            // coverage
            assertTrue(PlanInvariants.coversRiders(plan, riders));
            // conservation
            long[] expectedIds = new long[orders.size()];
            for (int i = 0; i < orders.size(); i++) {
                expectedIds[i] = orders.get(i).id();
            }
            LongArrays.quickSort(expectedIds);
            assertEquals(LongArrayList.wrap(expectedIds), plan.sortedOrderIds());
            assertTrue(PlanInvariants.duplicatedOrders(plan).isEmpty());
            // fairness
            assertTrue(PlanInvariants.loadSpread(plan) <= 1);
            // determinism
            for (int i = 0; i < orders.size(); i++) {
                int expectedRider = riders.get(i % riders.size()).id();
                assertEquals(expectedRider, plan.holderOf(orders.get(i).id()).getAsInt());
                assertEquals(orders.get(i).id(), plan.orders(expectedRider).getLong(i / riders.size()));
            }
        }
    }

    @Test
    @DisplayName("Rider keys follow rider input order")
    void testRiderInputOrder() {
        Plan plan = builder.build(riders(30, 10, 20), orders(1L, 2L, 3L, 4L));
        assertEquals(List.of(30, 10, 20), List.copyOf(plan.riderIds()));
        assertEquals(LongList.of(1L, 4L), plan.orders(30));
    }

    @Test
    @DisplayName("Duplicate order ids are refused by the plan")
    void testDuplicateOrderIds() {
        assertThrows(IllegalArgumentException.class, () -> builder.build(riders(1, 2), orders(5L, 5L)));
    }
}
