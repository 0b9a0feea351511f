package com.myorg.cafe.eventstore.upcast;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventstore.EventStore;
import com.myorg.cafe.eventstore.StoredSnapshot;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Every read leaves the store at the current revision.
 */
@RequiredArgsConstructor
public class UpcastingEventStore implements EventStore {
    private final EventStore delegate;
    private final UpcasterChain chain;

    @Override
    public List<EventEnvelope> append(String aggregateId, long expectedSequence, List<EventEnvelope> envelopes) {
        return delegate.append(aggregateId, expectedSequence, envelopes);
    }

    @Override
    public List<EventEnvelope> load(String aggregateId, long afterSequence) {
        return delegate.load(aggregateId, afterSequence).stream().map(chain::upcast).toList();
    }

    @Override
    public void readAll(Consumer<EventEnvelope> consumer) {
        delegate.readAll(env -> consumer.accept(chain.upcast(env)));
    }

    @Override
    public long lastSequence(String aggregateId) {
        return delegate.lastSequence(aggregateId);
    }

    @Override
    public Optional<StoredSnapshot> loadSnapshot(String aggregateId) {
        return delegate.loadSnapshot(aggregateId);
    }

    @Override
    public void storeSnapshot(StoredSnapshot snapshot) {
        delegate.storeSnapshot(snapshot);
    }

    public EventStore delegate() {
        return delegate;
    }
}
