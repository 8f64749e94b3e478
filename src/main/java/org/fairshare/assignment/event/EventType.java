package org.fairshare.assignment.event;

/**
 * Discriminator for runtime plan events.
 */
public enum EventType {
    /** A rider declines an order it currently holds. */
    RIDER_REJECTED,
    /** An order is withdrawn entirely. */
    ORDER_CANCELED
}
