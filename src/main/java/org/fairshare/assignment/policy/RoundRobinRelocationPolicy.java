package org.fairshare.assignment.policy;

import it.unimi.dsi.fastutil.ints.IntList;
import org.fairshare.assignment.model.Plan;

import java.util.Objects;

/**
 * Continues the rotation: picks the next rider id after the rejecting rider in
 * ascending id order, wrapping to the smallest id.
 */
final class RoundRobinRelocationPolicy implements RelocationPolicy {

    @Override
    public String id() {
        return RelocationPolicyRegistry.POLICY_ROUND_ROBIN;
    }

    @Override
    public int selectTarget(Plan plan, int rejectingRiderId) {
        Objects.requireNonNull(plan, "plan");
        IntList riderIds = plan.sortedRiderIds();
        if (riderIds.isEmpty() || (riderIds.size() == 1 && riderIds.getInt(0) == rejectingRiderId)) {
            throw new IllegalArgumentException("no rider other than " + rejectingRiderId + " in plan");
        }
        for (int i = 0; i < riderIds.size(); i++) {
            int riderId = riderIds.getInt(i);
            if (riderId > rejectingRiderId) {
                return riderId;
            }
        }
        return riderIds.getInt(0);
    }
}
