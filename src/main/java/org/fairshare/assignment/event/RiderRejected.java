package org.fairshare.assignment.event;

/**
 * A rider declines a specific order it currently holds.
 *
 * @param riderId rejecting rider id.
 * @param orderId rejected order id.
 */
public record RiderRejected(int riderId, long orderId) implements Event {

    @Override
    public EventType type() {
        return EventType.RIDER_REJECTED;
    }
}
