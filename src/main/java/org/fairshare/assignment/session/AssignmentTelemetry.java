package org.fairshare.assignment.session;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable session telemetry snapshot.
 */
@Value
@Builder
public class AssignmentTelemetry {

    /** Bound relocation policy id. */
    String relocationPolicyId;

    /** Events that produced a successor plan, including ignored ones. */
    long eventsApplied;

    /** Rejections that moved an order to another rider. */
    long relocations;

    /** Cancellations that removed an order. */
    long cancellations;

    /** Events that did not match the plan. */
    long ignoredEvents;

    /** Events that failed with an {@code AssignmentException}. */
    long failedEvents;

    /** Riders in the current plan. */
    int riderCount;

    /** Orders in the current plan. */
    int orderCount;
}
