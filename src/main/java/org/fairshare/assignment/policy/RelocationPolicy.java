package org.fairshare.assignment.policy;

import org.fairshare.assignment.model.Plan;

/**
 * Strategy contract for choosing the rider that receives a rejected order.
 *
 * <p>Implementations must be deterministic: the choice may depend only on the
 * plan's sorted views and the rejecting rider id, never on map iteration order.</p>
 */
public interface RelocationPolicy {

    /**
     * Returns stable policy identifier.
     */
    String id();

    /**
     * Selects the target rider for an order rejected by {@code rejectingRiderId}.
     *
     * <p>Loads are read from {@code plan} as it was before the rejected order was
     * removed; the rejecting rider itself is never a candidate.</p>
     *
     * @param plan plan in which {@code rejectingRiderId} still holds the order.
     * @param rejectingRiderId rider that rejected the order.
     * @return id of a rider other than {@code rejectingRiderId}.
     * @throws IllegalArgumentException when the plan has no rider other than
     * {@code rejectingRiderId}.
     */
    int selectTarget(Plan plan, int rejectingRiderId);
}
