package com.myorg.cafe.eventstore.aggregate;

/**
 * Folded state of one aggregate.
 *
 * @param sequence         last applied sequence, -1 when nothing was ever appended
 * @param snapshotSequence sequence of the snapshot the fold started from, -1 without one
 */
public record AggregateState<S>(String aggregateId, long sequence, long snapshotSequence, S state) {

    public static <S> AggregateState<S> empty(String aggregateId, S initial) {
        return new AggregateState<>(aggregateId, -1, -1, initial);
    }

    public boolean exists() {
        return sequence >= 0;
    }

    public long eventsSinceSnapshot() {
        return sequence - snapshotSequence;
    }

    AggregateState<S> advance(long newSequence, S newState) {
        return new AggregateState<>(aggregateId, newSequence, snapshotSequence, newState);
    }
}
