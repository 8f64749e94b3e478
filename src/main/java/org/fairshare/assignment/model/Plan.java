package org.fairshare.assignment.model;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongArrays;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable rider-to-orders assignment snapshot.
 *
 * <p>Each rider id maps to an ordered sequence of order ids; sequence order is the
 * delivery order for that rider. Key iteration follows rider insertion order, but
 * every selection decision made against a plan should go through the sorted views
 * ({@link #sortedRiderIds()}, {@link #sortedOrderIds()}).</p>
 *
 * <p>Structural guarantees:</p>
 * <ul>
 * <li>An order id is held by at most one rider.</li>
 * <li>A published plan never changes. New plans are derived through {@link Draft},
 *     which shares untouched rider sequences and copies the touched ones.</li>
 * </ul>
 */
public final class Plan {

    private static final Plan EMPTY = new Plan(new Int2ObjectLinkedOpenHashMap<>(), new Long2IntOpenHashMap());

    /** Rider id -> order sequence. Sequences are never mutated once published. */
    private final Int2ObjectLinkedOpenHashMap<LongArrayList> sequences;
    /** Order id -> holding rider id. */
    private final Long2IntOpenHashMap holders;

    private Plan(Int2ObjectLinkedOpenHashMap<LongArrayList> sequences, Long2IntOpenHashMap holders) {
        this.sequences = sequences;
        this.holders = holders;
    }

    /**
     * Returns the plan with no riders.
     */
    public static Plan empty() {
        return EMPTY;
    }

    /**
     * Starts a draft from an empty plan.
     */
    public static Draft draft() {
        return new Draft(EMPTY);
    }

    /**
     * Creates a plan from an explicit rider-to-orders mapping.
     *
     * <p>Riders are registered in the iteration order of {@code assignments}.</p>
     *
     * @param assignments rider id to ordered order ids.
     * @return immutable plan.
     * @throws IllegalArgumentException when one order id appears more than once.
     */
    public static Plan of(Map<Integer, ? extends Collection<Long>> assignments) {
        Objects.requireNonNull(assignments, "assignments");
        Draft draft = draft();
        for (Map.Entry<Integer, ? extends Collection<Long>> entry : assignments.entrySet()) {
            int riderId = Objects.requireNonNull(entry.getKey(), "riderId");
            draft.addRider(riderId);
            for (Long orderId : Objects.requireNonNull(entry.getValue(), "orders")) {
                draft.appendOrder(riderId, Objects.requireNonNull(orderId, "orderId"));
            }
        }
        return draft.publish();
    }

    /**
     * Starts a copy-on-write draft derived from this plan.
     */
    public Draft toDraft() {
        return new Draft(this);
    }

    public int riderCount() {
        return sequences.size();
    }

    public boolean containsRider(int riderId) {
        return sequences.containsKey(riderId);
    }

    /**
     * Returns the read-only order sequence of one rider.
     *
     * @throws IllegalArgumentException when the rider is not part of this plan.
     */
    public LongList orders(int riderId) {
        return LongLists.unmodifiable(requireSequence(riderId));
    }

    /**
     * Returns the number of orders currently held by one rider.
     *
     * @throws IllegalArgumentException when the rider is not part of this plan.
     */
    public int load(int riderId) {
        return requireSequence(riderId).size();
    }

    public boolean containsOrder(long orderId) {
        return holders.containsKey(orderId);
    }

    /**
     * Returns the rider currently holding {@code orderId}, or empty when unassigned.
     */
    public OptionalInt holderOf(long orderId) {
        if (!holders.containsKey(orderId)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(holders.get(orderId));
    }

    /**
     * Returns the total number of assigned orders across all riders.
     */
    public int totalOrders() {
        return holders.size();
    }

    /**
     * Returns rider ids in insertion order.
     */
    public IntList riderIds() {
        return IntLists.unmodifiable(new IntArrayList(sequences.keySet()));
    }

    /**
     * Returns rider ids in ascending order.
     */
    public IntList sortedRiderIds() {
        int[] ids = sequences.keySet().toIntArray();
        IntArrays.quickSort(ids);
        return IntLists.unmodifiable(IntArrayList.wrap(ids));
    }

    /**
     * Returns every assigned order id in ascending order.
     */
    public LongList sortedOrderIds() {
        long[] ids = holders.keySet().toLongArray();
        LongArrays.quickSort(ids);
        return LongLists.unmodifiable(LongArrayList.wrap(ids));
    }

    /**
     * Returns a boxed copy of this plan keyed in rider insertion order.
     */
    public Map<Integer, List<Long>> asMap() {
        LinkedHashMap<Integer, List<Long>> copy = new LinkedHashMap<>(sequences.size() * 2);
        for (Int2ObjectMap.Entry<LongArrayList> entry : sequences.int2ObjectEntrySet()) {
            copy.put(entry.getIntKey(), List.copyOf(new ArrayList<>(entry.getValue())));
        }
        return copy;
    }

    private LongArrayList requireSequence(int riderId) {
        LongArrayList sequence = sequences.get(riderId);
        if (sequence == null) {
            throw new IllegalArgumentException("unknown rider id: " + riderId);
        }
        return sequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Plan)) {
            return false;
        }
        return sequences.equals(((Plan) o).sequences);
    }

    @Override
    public int hashCode() {
        return sequences.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Plan{");
        IntIterator it = sequences.keySet().iterator();
        while (it.hasNext()) {
            int riderId = it.nextInt();
            sb.append(riderId).append('=').append(sequences.get(riderId));
            if (it.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append('}').toString();
    }

    /**
     * Single-use mutable builder for a new plan snapshot.
     *
     * <p>The draft starts as a shallow view of its base plan. A rider sequence is
     * copied the first time the draft touches it, so the base plan is never
     * mutated. A draft publishes exactly once.</p>
     */
    public static final class Draft {
        private final Int2ObjectLinkedOpenHashMap<LongArrayList> sequences;
        private final Long2IntOpenHashMap holders;
        private final IntOpenHashSet owned = new IntOpenHashSet();
        private boolean published;

        private Draft(Plan base) {
            this.sequences = new Int2ObjectLinkedOpenHashMap<>(base.sequences);
            this.holders = new Long2IntOpenHashMap(base.holders);
        }

        /**
         * Registers a rider with an empty sequence.
         *
         * @return {@code false} when the rider was already present.
         */
        public boolean addRider(int riderId) {
            ensureOpen();
            if (sequences.containsKey(riderId)) {
                return false;
            }
            sequences.put(riderId, new LongArrayList());
            owned.add(riderId);
            return true;
        }

        /**
         * Appends one order to the end of a rider's sequence.
         *
         * @throws IllegalArgumentException when the rider is unknown or the order is
         * already held by any rider.
         */
        public Draft appendOrder(int riderId, long orderId) {
            ensureOpen();
            if (holders.containsKey(orderId)) {
                throw new IllegalArgumentException(
                        "order " + orderId + " is already assigned to rider " + holders.get(orderId)
                );
            }
            writable(riderId).add(orderId);
            holders.put(orderId, riderId);
            return this;
        }

        /**
         * Removes one order from a specific rider's sequence.
         *
         * @return {@code true} when the rider held the order.
         */
        public boolean removeOrder(int riderId, long orderId) {
            ensureOpen();
            if (!holders.containsKey(orderId) || holders.get(orderId) != riderId) {
                return false;
            }
            writable(riderId).rem(orderId);
            holders.remove(orderId);
            return true;
        }

        /**
         * Removes one order from whichever rider holds it.
         *
         * @return former holder, or empty when the order was not assigned.
         */
        public OptionalInt removeOrder(long orderId) {
            ensureOpen();
            if (!holders.containsKey(orderId)) {
                return OptionalInt.empty();
            }
            int holder = holders.get(orderId);
            removeOrder(holder, orderId);
            return OptionalInt.of(holder);
        }

        /**
         * Publishes the draft as an immutable plan. The draft is unusable afterwards.
         */
        public Plan publish() {
            ensureOpen();
            published = true;
            return new Plan(sequences, holders);
        }

        private LongArrayList writable(int riderId) {
            LongArrayList sequence = sequences.get(riderId);
            if (sequence == null) {
                throw new IllegalArgumentException("unknown rider id: " + riderId);
            }
            if (owned.add(riderId)) {
                sequence = new LongArrayList(sequence);
                sequences.put(riderId, sequence);
            }
            return sequence;
        }

        private void ensureOpen() {
            if (published) {
                throw new IllegalStateException("draft already published");
            }
        }
    }
}
