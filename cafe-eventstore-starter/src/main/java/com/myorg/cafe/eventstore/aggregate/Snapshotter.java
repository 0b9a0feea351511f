package com.myorg.cafe.eventstore.aggregate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.cafe.eventstore.EventStore;
import com.myorg.cafe.eventstore.EventStoreMetrics;
import com.myorg.cafe.eventstore.StoredSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Writes snapshots off the command path. A failed snapshot only costs a longer fold next time.
 */
@Slf4j
public class Snapshotter implements AutoCloseable {

    private final EventStore store;
    private final ObjectMapper mapper;
    private final SnapshotPolicy policy;
    private final Executor executor;
    private final Clock clock;
    private final EventStoreMetrics metrics;

    public Snapshotter(EventStore store, ObjectMapper mapper, SnapshotPolicy policy,
                       Executor executor, Clock clock, EventStoreMetrics metrics) {
        this.store = store;
        this.mapper = mapper;
        this.policy = policy;
        this.executor = executor;
        this.clock = clock;
        this.metrics = metrics;
    }

    public static ExecutorService asyncExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "cafe-snapshotter");
            t.setDaemon(true);
            return t;
        });
    }

    public <S> void maybeSnapshot(String aggregateType, AggregateState<S> state) {
        if (!state.exists() || !policy.shouldSnapshot(aggregateType, state.eventsSinceSnapshot())) return;

        try {
            executor.execute(() -> write(aggregateType, state));
        } catch (RejectedExecutionException e) {
            log.warn("Snapshot rejected aggregateType={} aggregateId={} seq={}",
                    aggregateType, state.aggregateId(), state.sequence(), e);
            if (metrics != null) metrics.incSnapshotFailures();
        }
    }

    private <S> void write(String aggregateType, AggregateState<S> state) {
        try {
            String json = mapper.writeValueAsString(state.state());
            store.storeSnapshot(new StoredSnapshot(
                    state.aggregateId(), aggregateType, state.sequence(), json, clock.instant()));
            if (metrics != null) metrics.incSnapshots();
            log.debug("Snapshot stored aggregateType={} aggregateId={} seq={}",
                    aggregateType, state.aggregateId(), state.sequence());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Snapshot failed aggregateType={} aggregateId={} seq={}",
                    aggregateType, state.aggregateId(), state.sequence(), e);
            if (metrics != null) metrics.incSnapshotFailures();
        }
    }

    @Override
    public void close() {
        if (executor instanceof ExecutorService es) {
            es.shutdown();
            try {
                if (!es.awaitTermination(5, TimeUnit.SECONDS)) es.shutdownNow();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                es.shutdownNow();
            }
        }
    }
}
