package org.fairshare.assignment.model;

/**
 * Delivery rider identified by a unique integer id.
 *
 * @param id rider id; unique within one rider input collection.
 */
public record Rider(int id) {

    /**
     * Convenience factory mirroring {@link Order#of(long)}.
     */
    public static Rider of(int id) {
        return new Rider(id);
    }
}
