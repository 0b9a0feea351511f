package com.myorg.cafe.eventstore.aggregate;

import java.util.Map;

/**
 * Snapshot once an aggregate has accumulated a per-type number of events since its last snapshot.
 * A threshold of zero or less disables snapshots for that type.
 */
public class EventCountSnapshotPolicy implements SnapshotPolicy {

    private final Map<String, Integer> thresholds;
    private final int defaultThreshold;

    public EventCountSnapshotPolicy(Map<String, Integer> thresholds, int defaultThreshold) {
        this.thresholds = thresholds == null ? Map.of() : Map.copyOf(thresholds);
        this.defaultThreshold = defaultThreshold;
    }

    public int thresholdFor(String aggregateType) {
        return thresholds.getOrDefault(aggregateType, defaultThreshold);
    }

    @Override
    public boolean shouldSnapshot(String aggregateType, long eventsSinceLastSnapshot) {
        int threshold = thresholdFor(aggregateType);
        return threshold > 0 && eventsSinceLastSnapshot >= threshold;
    }
}
