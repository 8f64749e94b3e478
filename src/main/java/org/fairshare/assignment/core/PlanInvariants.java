package org.fairshare.assignment.core;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import org.fairshare.assignment.event.OrderCanceled;
import org.fairshare.assignment.event.RiderRejected;
import org.fairshare.assignment.model.Plan;
import org.fairshare.assignment.model.Rider;

import java.util.Collection;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Shared plan invariant checks.
 *
 * <p>Predicates answer one question each; the {@code verify*} methods raise
 * {@link AssignmentCore#REASON_INVARIANT_VIOLATION} on the first broken invariant.</p>
 */
public final class PlanInvariants {

    private PlanInvariants() {
    }

    /**
     * Returns order ids that appear in more than one position across all sequences,
     * in ascending order.
     *
     * <p>Full scan over every sequence. {@link Plan.Draft} refuses an order that is
     * already held, so the result is empty for any published plan; this is the
     * diagnostic listing behind a failed {@link #verifyStructure(Plan)}.</p>
     */
    public static LongList duplicatedOrders(Plan plan) {
        Objects.requireNonNull(plan, "plan");
        Long2IntOpenHashMap occurrences = new Long2IntOpenHashMap();
        IntList riderIds = plan.sortedRiderIds();
        for (int i = 0; i < riderIds.size(); i++) {
            LongList orders = plan.orders(riderIds.getInt(i));
            for (int j = 0; j < orders.size(); j++) {
                occurrences.addTo(orders.getLong(j), 1);
            }
        }
        LongList duplicates = new LongArrayList();
        LongList sorted = plan.sortedOrderIds();
        for (int i = 0; i < sorted.size(); i++) {
            if (occurrences.get(sorted.getLong(i)) > 1) {
                duplicates.add(sorted.getLong(i));
            }
        }
        return duplicates;
    }

    /**
     * Returns {@code max(load) - min(load)} across riders, or {@code 0} for a plan
     * without riders.
     */
    public static int loadSpread(Plan plan) {
        Objects.requireNonNull(plan, "plan");
        IntList riderIds = plan.sortedRiderIds();
        if (riderIds.isEmpty()) {
            return 0;
        }
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int i = 0; i < riderIds.size(); i++) {
            int load = plan.load(riderIds.getInt(i));
            min = Math.min(min, load);
            max = Math.max(max, load);
        }
        return max - min;
    }

    /**
     * Returns whether any two riders' loads differ by at most one.
     */
    public static boolean isFair(Plan plan) {
        return loadSpread(plan) <= 1;
    }

    /**
     * Returns whether every given rider is present with a non-empty sequence.
     */
    public static boolean coversRiders(Plan plan, Collection<Rider> riders) {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(riders, "riders");
        for (Rider rider : riders) {
            int riderId = Objects.requireNonNull(rider, "rider").id();
            if (!plan.containsRider(riderId) || plan.load(riderId) == 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns whether both plans hold exactly the same order ids.
     */
    public static boolean conservesOrders(Plan before, Plan after) {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
        return before.sortedOrderIds().equals(after.sortedOrderIds());
    }

    /**
     * Verifies that no order id is held twice: the sequence lengths must add up to
     * the number of distinct assigned orders. Runs in time linear in the rider count.
     */
    public static void verifyStructure(Plan plan) {
        Objects.requireNonNull(plan, "plan");
        IntList riderIds = plan.riderIds();
        long positions = 0;
        for (int i = 0; i < riderIds.size(); i++) {
            positions += plan.load(riderIds.getInt(i));
        }
        if (positions != plan.totalOrders()) {
            throw violation(positions + " order positions for " + plan.totalOrders()
                    + " distinct orders, repeated: " + duplicatedOrders(plan));
        }
    }

    /**
     * Verifies structure and the load-spread bound of a freshly built plan.
     */
    public static void verifyBuilt(Plan plan) {
        verifyStructure(plan);
        int spread = loadSpread(plan);
        if (spread > 1) {
            throw violation("load spread " + spread + " exceeds 1 in " + plan);
        }
    }

    /**
     * Verifies the postconditions of one processed event against its input plan.
     *
     * @param before plan passed into the event processor.
     * @param result event processor output.
     */
    public static void verifyTransition(Plan before, EventResult result) {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(result, "result");
        Plan after = result.plan();
        verifyStructure(after);
        if (!before.riderIds().equals(after.riderIds())) {
            throw violation("rider set changed from " + before.riderIds() + " to " + after.riderIds());
        }
        switch (result.outcome()) {
            case IGNORED -> {
                if (!before.equals(after)) {
                    throw violation("ignored event changed the plan");
                }
            }
            case RELOCATED -> verifyRelocation(before, after, result);
            case CANCELED -> verifyCancellation(before, after, result);
        }
    }

    private static void verifyRelocation(Plan before, Plan after, EventResult result) {
        if (!conservesOrders(before, after)) {
            throw violation("relocation changed the order set");
        }
        long orderId = rejectedOrderId(result);
        OptionalInt holder = after.holderOf(orderId);
        int source = result.sourceRiderId().orElseThrow();
        if (holder.isEmpty() || holder.getAsInt() == source) {
            throw violation("order " + orderId + " was not moved away from rider " + source);
        }
    }

    private static void verifyCancellation(Plan before, Plan after, EventResult result) {
        long orderId = canceledOrderId(result);
        if (after.containsOrder(orderId)) {
            throw violation("canceled order " + orderId + " is still assigned");
        }
        if (after.totalOrders() != before.totalOrders() - 1) {
            throw violation("cancellation of order " + orderId + " removed more than one order");
        }
    }

    private static long rejectedOrderId(EventResult result) {
        return ((RiderRejected) result.event()).orderId();
    }

    private static long canceledOrderId(EventResult result) {
        return ((OrderCanceled) result.event()).orderId();
    }

    private static AssignmentException violation(String message) {
        return new AssignmentException(AssignmentCore.REASON_INVARIANT_VIOLATION, message);
    }
}
