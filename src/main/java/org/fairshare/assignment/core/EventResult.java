package org.fairshare.assignment.core;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.fairshare.assignment.event.Event;
import org.fairshare.assignment.model.Plan;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Result payload for one {@link EventProcessor#process(Plan, Event)} call.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@Accessors(fluent = true)
public final class EventResult {
    private static final int NO_RIDER = Integer.MIN_VALUE;

    /** Plan after the event. Same instance as the input plan for {@link EventOutcome#IGNORED}. */
    private final Plan plan;
    /** Event that produced this result. */
    private final Event event;
    /** Effect classification. */
    private final EventOutcome outcome;
    @Getter(AccessLevel.NONE)
    private final int sourceRiderId;
    @Getter(AccessLevel.NONE)
    private final int targetRiderId;
    @Getter(AccessLevel.NONE)
    private final boolean hasSource;
    @Getter(AccessLevel.NONE)
    private final boolean hasTarget;

    static EventResult relocated(Plan plan, Event event, int sourceRiderId, int targetRiderId) {
        return new EventResult(
                Objects.requireNonNull(plan, "plan"), event, EventOutcome.RELOCATED,
                sourceRiderId, targetRiderId, true, true
        );
    }

    static EventResult canceled(Plan plan, Event event, int formerHolderId) {
        return new EventResult(
                Objects.requireNonNull(plan, "plan"), event, EventOutcome.CANCELED,
                formerHolderId, NO_RIDER, true, false
        );
    }

    static EventResult ignored(Plan plan, Event event) {
        return new EventResult(
                Objects.requireNonNull(plan, "plan"), event, EventOutcome.IGNORED,
                NO_RIDER, NO_RIDER, false, false
        );
    }

    /**
     * Rider that lost the order (rejecting rider or canceled order's holder).
     */
    public OptionalInt sourceRiderId() {
        return hasSource ? OptionalInt.of(sourceRiderId) : OptionalInt.empty();
    }

    /**
     * Rider that received a relocated order.
     */
    public OptionalInt targetRiderId() {
        return hasTarget ? OptionalInt.of(targetRiderId) : OptionalInt.empty();
    }

    /**
     * Returns whether the event changed the plan.
     */
    public boolean changed() {
        return outcome != EventOutcome.IGNORED;
    }
}
