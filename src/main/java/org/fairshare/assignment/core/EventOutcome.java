package org.fairshare.assignment.core;

/**
 * Effect of one processed event on the plan.
 */
public enum EventOutcome {
    /** A rejected order moved to another rider. */
    RELOCATED,
    /** A canceled order was removed from its holder. */
    CANCELED,
    /** The event did not match the plan; the plan is unchanged. */
    IGNORED
}
