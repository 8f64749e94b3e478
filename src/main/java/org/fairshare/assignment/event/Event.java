package org.fairshare.assignment.event;

/**
 * Externally observed occurrence that requires a plan update.
 *
 * <p>Implementations are immutable value types; {@link #type()} selects the
 * transition applied by the event processor.</p>
 */
public interface Event {

    EventType type();

    /**
     * Creates a rejection event for one rider/order pair.
     */
    static RiderRejected riderRejected(int riderId, long orderId) {
        return new RiderRejected(riderId, orderId);
    }

    /**
     * Creates a cancellation event for one order.
     */
    static OrderCanceled orderCanceled(long orderId) {
        return new OrderCanceled(orderId);
    }
}
