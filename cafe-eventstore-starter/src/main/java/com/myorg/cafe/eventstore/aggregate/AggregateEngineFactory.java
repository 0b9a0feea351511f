package com.myorg.cafe.eventstore.aggregate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.cafe.eventing.CafePublisher;
import com.myorg.cafe.eventstore.EventStore;
import com.myorg.cafe.eventstore.EventStoreMetrics;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class AggregateEngineFactory {
    private final EventStore store;
    private final CafePublisher publisher;
    private final Snapshotter snapshotter;
    private final ObjectMapper mapper;
    private final String producer;
    private final EventStoreMetrics metrics;

    public <S, C, E> AggregateEngine<S, C, E> create(AggregateDefinition<S, C, E> definition) {
        return new AggregateEngine<>(definition, store, publisher, snapshotter, mapper, producer, metrics);
    }
}
