package org.fairshare.assignment.core;

import org.fairshare.assignment.model.Order;
import org.fairshare.assignment.model.Plan;
import org.fairshare.assignment.model.Rider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Builds the initial assignment with strict round robin.
 *
 * <p>The order at input position {@code i} goes to the rider at input position
 * {@code i mod |riders|}, appended to that rider's sequence. Every rider therefore
 * receives either {@code floor(|orders|/|riders|)} orders or one more. When there are
 * fewer orders than riders, the trailing riders keep an empty sequence.</p>
 *
 * <p>Rider and order ids are assumed unique within their inputs. Duplicate rider ids
 * collapse onto one plan key; a duplicate order id is refused by the plan itself.</p>
 */
public final class PlanBuilder {
    private static final Logger log = LoggerFactory.getLogger(PlanBuilder.class);

    /**
     * Builds the initial plan.
     *
     * @param riders riders in input order.
     * @param orders orders in input order.
     * @return round-robin plan with every rider registered.
     * @throws AssignmentException with {@link AssignmentCore#REASON_EMPTY_RIDER_SET} when
     * {@code riders} is empty.
     */
    public Plan build(List<Rider> riders, List<Order> orders) {
        if (riders == null) {
            throw new AssignmentException(AssignmentCore.REASON_RIDERS_REQUIRED, "riders must be provided");
        }
        if (orders == null) {
            throw new AssignmentException(AssignmentCore.REASON_ORDERS_REQUIRED, "orders must be provided");
        }
        if (riders.isEmpty()) {
            throw new AssignmentException(
                    AssignmentCore.REASON_EMPTY_RIDER_SET,
                    "at least one rider is required to assign " + orders.size() + " orders"
            );
        }

        Plan.Draft draft = Plan.draft();
        int[] riderSlots = new int[riders.size()];
        int slot = 0;
        for (Rider rider : riders) {
            int riderId = Objects.requireNonNull(rider, "rider").id();
            riderSlots[slot++] = riderId;
            draft.addRider(riderId);
        }

        int position = 0;
        for (Order order : orders) {
            long orderId = Objects.requireNonNull(order, "order").id();
            draft.appendOrder(riderSlots[position % riderSlots.length], orderId);
            position++;
        }

        Plan plan = draft.publish();
        log.debug("Built plan for {} riders and {} orders", plan.riderCount(), plan.totalOrders());
        return plan;
    }
}
