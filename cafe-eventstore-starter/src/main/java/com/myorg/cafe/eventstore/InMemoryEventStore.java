package com.myorg.cafe.eventstore;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventstore.exception.ConcurrencyConflictException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

// For tests and single-process demos; everything is lost on restart.
public class InMemoryEventStore implements EventStore {

    private final List<EventEnvelope> log = new ArrayList<>();
    private final Map<String, List<EventEnvelope>> byAggregate = new HashMap<>();
    private final Map<String, StoredSnapshot> snapshots = new HashMap<>();

    @Override
    public synchronized List<EventEnvelope> append(String aggregateId, long expectedSequence, List<EventEnvelope> envelopes) {
        if (envelopes == null || envelopes.isEmpty()) return List.of();

        long actual = lastSequence(aggregateId);
        if (actual != expectedSequence) {
            throw new ConcurrencyConflictException(aggregateId, expectedSequence, actual);
        }
        List<EventEnvelope> stream = byAggregate.computeIfAbsent(aggregateId, k -> new ArrayList<>());
        for (EventEnvelope env : envelopes) {
            EventEnvelope stored = env.toBuilder().revision(env.effectiveRevision()).build();
            stream.add(stored);
            log.add(stored);
        }
        return envelopes;
    }

    @Override
    public synchronized List<EventEnvelope> load(String aggregateId, long afterSequence) {
        return byAggregate.getOrDefault(aggregateId, List.of()).stream()
                .filter(e -> e.getSequence() > afterSequence)
                .map(e -> e.toBuilder().payload(e.getPayload().deepCopy()).build())
                .toList();
    }

    @Override
    public void readAll(Consumer<EventEnvelope> consumer) {
        List<EventEnvelope> copy;
        synchronized (this) {
            copy = new ArrayList<>(log);
        }
        copy.forEach(e -> consumer.accept(e.toBuilder().payload(e.getPayload().deepCopy()).build()));
    }

    @Override
    public synchronized long lastSequence(String aggregateId) {
        List<EventEnvelope> stream = byAggregate.get(aggregateId);
        return stream == null || stream.isEmpty() ? -1 : stream.get(stream.size() - 1).getSequence();
    }

    @Override
    public synchronized Optional<StoredSnapshot> loadSnapshot(String aggregateId) {
        return Optional.ofNullable(snapshots.get(aggregateId));
    }

    @Override
    public synchronized void storeSnapshot(StoredSnapshot snapshot) {
        snapshots.merge(snapshot.aggregateId(), snapshot,
                (cur, next) -> next.sequence() > cur.sequence() ? next : cur);
    }
}
