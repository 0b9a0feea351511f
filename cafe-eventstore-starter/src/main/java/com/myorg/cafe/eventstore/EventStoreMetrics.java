package com.myorg.cafe.eventstore;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class EventStoreMetrics {

    private final MeterRegistry registry;

    private Counter appended;
    private Counter conflicts;
    private Counter snapshots;
    private Counter snapshotFailures;

    public void preRegister() {
        appended = Counter.builder("cafe.eventstore.appended").register(registry);
        conflicts = Counter.builder("cafe.eventstore.conflicts").register(registry);
        snapshots = Counter.builder("cafe.eventstore.snapshots").register(registry);
        snapshotFailures = Counter.builder("cafe.eventstore.snapshots.failed").register(registry);
    }

    public void incAppended(int n) { if (appended != null) appended.increment(n); }
    public void incConflicts() { if (conflicts != null) conflicts.increment(); }
    public void incSnapshots() { if (snapshots != null) snapshots.increment(); }
    public void incSnapshotFailures() { if (snapshotFailures != null) snapshotFailures.increment(); }
}
