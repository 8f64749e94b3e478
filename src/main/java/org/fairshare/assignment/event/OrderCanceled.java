package org.fairshare.assignment.event;

/**
 * An order is withdrawn from the plan entirely.
 *
 * @param orderId canceled order id.
 */
public record OrderCanceled(long orderId) implements Event {

    @Override
    public EventType type() {
        return EventType.ORDER_CANCELED;
    }
}
