package org.fairshare.assignment.core;

import org.fairshare.assignment.event.Event;
import org.fairshare.assignment.event.EventType;
import org.fairshare.assignment.event.OrderCanceled;
import org.fairshare.assignment.event.RiderRejected;
import org.fairshare.assignment.model.Plan;
import org.fairshare.assignment.policy.RelocationPolicy;
import org.fairshare.assignment.policy.RelocationPolicyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Applies one runtime event to a plan and returns the successor plan.
 *
 * <p>Transitions:</p>
 * <ul>
 * <li>{@link RiderRejected}: when the rider holds the order, the order leaves that
 *     rider and is appended to the rider chosen by the bound {@link RelocationPolicy}.
 *     Mismatched rider/order pairs are ignored. A lone rider cannot hand the order
 *     over and the call fails with {@link AssignmentCore#REASON_NO_ALTERNATE_RIDER}.</li>
 * <li>{@link OrderCanceled}: the order leaves its holder; unknown orders are ignored.</li>
 * </ul>
 *
 * <p>The input plan is never modified. Riders are never added or removed.</p>
 */
public final class EventProcessor {
    private static final Logger log = LoggerFactory.getLogger(EventProcessor.class);

    private final RelocationPolicy relocationPolicy;

    /**
     * Creates a processor using the {@code LEAST_LOADED} relocation policy.
     */
    public EventProcessor() {
        this(RelocationPolicyRegistry.defaultRegistry().defaultPolicy());
    }

    /**
     * Creates a processor with an explicit relocation policy.
     *
     * @param relocationPolicy target-rider selection for rejected orders.
     */
    public EventProcessor(RelocationPolicy relocationPolicy) {
        this.relocationPolicy = Objects.requireNonNull(relocationPolicy, "relocationPolicy");
    }

    /**
     * Returns the bound relocation policy.
     */
    public RelocationPolicy relocationPolicy() {
        return relocationPolicy;
    }

    /**
     * Applies one event and returns only the successor plan.
     */
    public Plan apply(Plan plan, Event event) {
        return process(plan, event).plan();
    }

    /**
     * Applies one event.
     *
     * @param plan current plan.
     * @param event runtime event.
     * @return successor plan with outcome metadata.
     * @throws AssignmentException when the event cannot be applied.
     */
    public EventResult process(Plan plan, Event event) {
        if (plan == null) {
            throw new AssignmentException(AssignmentCore.REASON_PLAN_REQUIRED, "plan must be provided");
        }
        if (event == null) {
            throw new AssignmentException(AssignmentCore.REASON_EVENT_REQUIRED, "event must be provided");
        }
        EventType type = Objects.requireNonNull(event.type(), "event.type");
        return switch (type) {
            case RIDER_REJECTED -> onRiderRejected(plan, payload(event, RiderRejected.class));
            case ORDER_CANCELED -> onOrderCanceled(plan, payload(event, OrderCanceled.class));
        };
    }

    private EventResult onRiderRejected(Plan plan, RiderRejected event) {
        int riderId = event.riderId();
        long orderId = event.orderId();
        OptionalInt holder = plan.holderOf(orderId);
        if (holder.isEmpty() || holder.getAsInt() != riderId) {
            log.debug("Ignoring rejection of order {} by rider {}: not held by that rider", orderId, riderId);
            return EventResult.ignored(plan, event);
        }
        if (plan.riderCount() == 1) {
            throw new AssignmentException(
                    AssignmentCore.REASON_NO_ALTERNATE_RIDER,
                    "rider " + riderId + " rejected order " + orderId + " but is the only rider in the plan"
            );
        }

        int targetRiderId = relocationPolicy.selectTarget(plan, riderId);
        if (targetRiderId == riderId || !plan.containsRider(targetRiderId)) {
            throw new AssignmentException(
                    AssignmentCore.REASON_INVALID_RELOCATION_TARGET,
                    "policy " + relocationPolicy.id() + " selected invalid target rider " + targetRiderId
                            + " for order " + orderId + " rejected by rider " + riderId
            );
        }

        Plan.Draft draft = plan.toDraft();
        draft.removeOrder(riderId, orderId);
        draft.appendOrder(targetRiderId, orderId);
        log.debug("Relocated order {} from rider {} to rider {}", orderId, riderId, targetRiderId);
        return EventResult.relocated(draft.publish(), event, riderId, targetRiderId);
    }

    private EventResult onOrderCanceled(Plan plan, OrderCanceled event) {
        long orderId = event.orderId();
        OptionalInt holder = plan.holderOf(orderId);
        if (holder.isEmpty()) {
            log.debug("Ignoring cancellation of unassigned order {}", orderId);
            return EventResult.ignored(plan, event);
        }
        Plan.Draft draft = plan.toDraft();
        draft.removeOrder(holder.getAsInt(), orderId);
        log.debug("Canceled order {} held by rider {}", orderId, holder.getAsInt());
        return EventResult.canceled(draft.publish(), event, holder.getAsInt());
    }

    private static <T extends Event> T payload(Event event, Class<T> payloadType) {
        if (!payloadType.isInstance(event)) {
            throw new IllegalArgumentException(
                    "event type " + event.type() + " requires a " + payloadType.getSimpleName() + " payload"
            );
        }
        return payloadType.cast(event);
    }
}
