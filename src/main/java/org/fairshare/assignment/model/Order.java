package org.fairshare.assignment.model;

/**
 * Delivery order identified by a unique integer id.
 *
 * @param id order id; unique within one order input collection.
 */
public record Order(long id) {

    public static Order of(long id) {
        return new Order(id);
    }
}
