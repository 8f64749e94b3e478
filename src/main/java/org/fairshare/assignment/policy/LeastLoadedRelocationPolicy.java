package org.fairshare.assignment.policy;

import it.unimi.dsi.fastutil.ints.IntList;
import org.fairshare.assignment.model.Plan;

import java.util.Objects;

/**
 * Picks the rider holding the fewest orders; ties go to the smallest rider id.
 */
final class LeastLoadedRelocationPolicy implements RelocationPolicy {

    @Override
    public String id() {
        return RelocationPolicyRegistry.POLICY_LEAST_LOADED;
    }

    @Override
    public int selectTarget(Plan plan, int rejectingRiderId) {
        Objects.requireNonNull(plan, "plan");
        IntList riderIds = plan.sortedRiderIds();
        boolean found = false;
        int bestRider = 0;
        int bestLoad = Integer.MAX_VALUE;
        // ascending ids, so strict comparison keeps the smallest id on ties
        for (int i = 0; i < riderIds.size(); i++) {
            int riderId = riderIds.getInt(i);
            if (riderId == rejectingRiderId) {
                continue;
            }
            int load = plan.load(riderId);
            if (!found || load < bestLoad) {
                found = true;
                bestRider = riderId;
                bestLoad = load;
            }
        }
        if (!found) {
            throw new IllegalArgumentException("no rider other than " + rejectingRiderId + " in plan");
        }
        return bestRider;
    }
}
