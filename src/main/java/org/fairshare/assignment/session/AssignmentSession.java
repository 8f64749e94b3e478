package org.fairshare.assignment.session;

import org.fairshare.assignment.core.AssignmentException;
import org.fairshare.assignment.core.AssignmentService;
import org.fairshare.assignment.core.EventOutcome;
import org.fairshare.assignment.core.EventResult;
import org.fairshare.assignment.event.Event;
import org.fairshare.assignment.model.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live plan holder for one ordered event stream.
 *
 * <p>Plan invariants depend on a consistent global view, so events against one plan
 * are applied strictly one after another:</p>
 * <ul>
 * <li>Writers are serialized by a single lock; each event is fully applied before the
 *     next one starts.</li>
 * <li>Readers are lock-free and observe the most recently published plan.</li>
 * <li>A failed event leaves the published plan untouched.</li>
 * </ul>
 */
public final class AssignmentSession {
    private static final Logger log = LoggerFactory.getLogger(AssignmentSession.class);

    private final AssignmentService assignmentService;
    private final String relocationPolicyId;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile Plan current;

    // guarded by writeLock
    private final OutcomeCounts published = new OutcomeCounts();
    private long failedEvents;

    /**
     * Opens a session over an existing plan.
     *
     * @param assignmentService service used to apply events.
     * @param initialPlan starting plan.
     * @param relocationPolicyId policy id reported in telemetry; may be {@code null}.
     */
    public AssignmentSession(AssignmentService assignmentService, Plan initialPlan, String relocationPolicyId) {
        this.assignmentService = Objects.requireNonNull(assignmentService, "assignmentService");
        this.current = Objects.requireNonNull(initialPlan, "initialPlan");
        this.relocationPolicyId = relocationPolicyId;
        log.info("Opened assignment session: riders={}, orders={}", initialPlan.riderCount(), initialPlan.totalOrders());
    }

    /**
     * Returns the most recently published plan.
     */
    public Plan current() {
        return current;
    }

    /**
     * Applies one event and publishes the successor plan.
     *
     * @param event runtime event.
     * @return processing result; its plan is the newly published one.
     * @throws AssignmentException when the event cannot be applied; the current plan
     * is unchanged.
     */
    public EventResult apply(Event event) {
        writeLock.lock();
        try {
            EventResult result = processOrCountFailure(current, event);
            current = result.plan();
            published.record(result.outcome());
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Applies events in list order and publishes only the final plan.
     *
     * <p>All-or-nothing: when any event fails, nothing is published and the exception
     * propagates. Outcomes of the rolled-back events are not counted; only the failure
     * is.</p>
     *
     * @param events events in arrival order.
     * @return per-event results in input order.
     */
    public List<EventResult> applyAll(List<? extends Event> events) {
        Objects.requireNonNull(events, "events");
        writeLock.lock();
        try {
            Plan working = current;
            OutcomeCounts batch = new OutcomeCounts();
            List<EventResult> results = new ArrayList<>(events.size());
            for (Event event : events) {
                EventResult result = processOrCountFailure(working, event);
                batch.record(result.outcome());
                results.add(result);
                working = result.plan();
            }
            current = working;
            published.add(batch);
            log.debug("Published batch of {} events: {}", results.size(), batch);
            return List.copyOf(results);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns a consistent telemetry snapshot.
     */
    public AssignmentTelemetry telemetry() {
        writeLock.lock();
        try {
            Plan plan = current;
            return AssignmentTelemetry.builder()
                    .relocationPolicyId(relocationPolicyId)
                    .eventsApplied(published.total())
                    .relocations(published.relocations)
                    .cancellations(published.cancellations)
                    .ignoredEvents(published.ignored)
                    .failedEvents(failedEvents)
                    .riderCount(plan.riderCount())
                    .orderCount(plan.totalOrders())
                    .build();
        } finally {
            writeLock.unlock();
        }
    }

    private EventResult processOrCountFailure(Plan plan, Event event) {
        try {
            return assignmentService.process(plan, event);
        } catch (AssignmentException ex) {
            failedEvents++;
            throw ex;
        }
    }

    /** Per-outcome tallies of events whose successor plan was published. */
    private static final class OutcomeCounts {
        private long relocations;
        private long cancellations;
        private long ignored;

        void record(EventOutcome outcome) {
            switch (outcome) {
                case RELOCATED -> relocations++;
                case CANCELED -> cancellations++;
                case IGNORED -> ignored++;
            }
        }

        void add(OutcomeCounts other) {
            relocations += other.relocations;
            cancellations += other.cancellations;
            ignored += other.ignored;
        }

        long total() {
            return relocations + cancellations + ignored;
        }

        @Override
        public String toString() {
            return "relocated=" + relocations + ", canceled=" + cancellations + ", ignored=" + ignored;
        }
    }
}
