package org.fairshare.assignment.testutil;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.longs.LongList;
import org.fairshare.assignment.event.Event;
import org.fairshare.assignment.model.Plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Index-based event description resolved against a plan's sorted rider and order views.
 *
 * @param riderRejection {@code true} for a rejection, {@code false} for a cancellation.
 * @param riderIndex rider index (rejections only); taken modulo the rider count.
 * @param orderIndex order index; taken modulo the rider's sequence length for rejections
 *                   and modulo the total order count for cancellations.
 */
public record IndexedEvent(boolean riderRejection, int riderIndex, int orderIndex) {

    /**
     * Resolves this description into a concrete event.
     *
     * @param plan plan providing the sorted enumerations; every rider must hold at least one order.
     */
    public Event resolve(Plan plan) {
        if (riderRejection) {
            IntList riderIds = plan.sortedRiderIds();
            int riderId = riderIds.getInt(Math.floorMod(riderIndex, riderIds.size()));
            LongList orders = plan.orders(riderId);
            return Event.riderRejected(riderId, orders.getLong(Math.floorMod(orderIndex, orders.size())));
        }
        LongList orderIds = plan.sortedOrderIds();
        return Event.orderCanceled(orderIds.getLong(Math.floorMod(orderIndex, orderIds.size())));
    }

    /**
     * Draws a random script of {@code count} descriptions.
     */
    public static List<IndexedEvent> randomScript(Random random, int count) {
        List<IndexedEvent> script = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            script.add(new IndexedEvent(random.nextBoolean(), random.nextInt(1_000), random.nextInt(1_000)));
        }
        return script;
    }

    /**
     * Resolves a whole script against one plan.
     */
    public static List<Event> resolveAll(List<IndexedEvent> script, Plan plan) {
        List<Event> events = new ArrayList<>(script.size());
        for (IndexedEvent indexedEvent : script) {
            events.add(indexedEvent.resolve(plan));
        }
        return events;
    }
}
