package org.fairshare.assignment.core;

import org.fairshare.assignment.event.Event;
import org.fairshare.assignment.model.Order;
import org.fairshare.assignment.model.Plan;
import org.fairshare.assignment.model.Rider;

import java.util.List;

/**
 * Public plan-building and event-application contract.
 *
 * <p>Implementations are expected to perform deterministic input validation and
 * throw {@link AssignmentException} with a stable reason code for contract failures.</p>
 */
public interface AssignmentService {

    /**
     * Builds the initial fair assignment.
     *
     * @param riders riders in input order; must be non-empty.
     * @param orders orders in input order.
     * @return initial plan.
     */
    Plan build(List<Rider> riders, List<Order> orders);

    /**
     * Applies one runtime event to a plan.
     *
     * @param plan current plan.
     * @param event runtime event.
     * @return updated plan (the same instance when the event is a no-op).
     */
    Plan apply(Plan plan, Event event);

    /**
     * Applies one runtime event and reports what changed.
     *
     * @param plan current plan.
     * @param event runtime event.
     * @return updated plan with outcome metadata.
     */
    EventResult process(Plan plan, Event event);
}
