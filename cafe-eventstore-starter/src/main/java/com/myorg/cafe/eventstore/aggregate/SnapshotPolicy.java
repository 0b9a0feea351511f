package com.myorg.cafe.eventstore.aggregate;

@FunctionalInterface
public interface SnapshotPolicy {
    boolean shouldSnapshot(String aggregateType, long eventsSinceLastSnapshot);

    static SnapshotPolicy never() {
        return (type, n) -> false;
    }
}
