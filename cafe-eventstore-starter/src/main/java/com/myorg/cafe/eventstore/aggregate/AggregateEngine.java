package com.myorg.cafe.eventstore.aggregate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.cafe.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.CafePublisher;
import com.myorg.cafe.eventstore.EventStore;
import com.myorg.cafe.eventstore.EventStoreMetrics;
import com.myorg.cafe.eventstore.StoredSnapshot;
import com.myorg.cafe.eventstore.exception.AggregateNotFoundException;
import com.myorg.cafe.eventstore.exception.ConcurrencyConflictException;
import com.myorg.cafe.eventstore.exception.InvalidStateTransitionException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Load, decide, append, publish for one aggregate type.
 *
 * <p>The engine never retries a {@link ConcurrencyConflictException}; callers reload and
 * resubmit if they want to. Events are published only after the append committed.
 */
@Slf4j
public class AggregateEngine<S, C, E> {

    private final AggregateDefinition<S, C, E> definition;
    private final EventStore store;
    private final CafePublisher publisher;
    private final Snapshotter snapshotter;
    private final ObjectMapper mapper;
    private final String producer;
    private final EventStoreMetrics metrics;

    public AggregateEngine(AggregateDefinition<S, C, E> definition,
                           EventStore store,
                           CafePublisher publisher,
                           Snapshotter snapshotter,
                           ObjectMapper mapper,
                           String producer,
                           EventStoreMetrics metrics) {
        this.definition = definition;
        this.store = store;
        this.publisher = publisher;
        this.snapshotter = snapshotter;
        this.mapper = mapper;
        this.producer = producer;
        this.metrics = metrics;
    }

    public AggregateState<S> load(String aggregateId) {
        AggregateState<S> start = AggregateState.empty(aggregateId, definition.initialState());

        Optional<StoredSnapshot> snapshot = store.loadSnapshot(aggregateId);
        if (snapshot.isPresent()) {
            StoredSnapshot snap = snapshot.get();
            try {
                S restored = mapper.readValue(snap.stateJson(), definition.stateClass());
                start = new AggregateState<>(aggregateId, snap.sequence(), snap.sequence(), restored);
            } catch (JsonProcessingException e) {
                // unreadable snapshot: fold from the first event instead
                log.warn("Ignoring unreadable snapshot aggregateType={} aggregateId={} seq={}",
                        definition.aggregateType(), aggregateId, snap.sequence(), e);
            }
        }

        return fold(start, store.load(aggregateId, start.sequence()));
    }

    public List<E> handle(AggregateState<S> current, C command) {
        return definition.handle(current, command);
    }

    public List<EventEnvelope> append(String aggregateId, long expectedSequence, List<E> events) {
        return append(aggregateId, expectedSequence, events, null, null);
    }

    public List<EventEnvelope> append(String aggregateId, long expectedSequence, List<E> events,
                                      String correlationId, String causationId) {
        List<EventEnvelope> envelopes = new ArrayList<>(events.size());
        long seq = expectedSequence;
        for (E event : events) {
            seq++;
            envelopes.add(EnvelopeBuilder.wrap(
                    mapper,
                    definition.eventTypes().typeOf(event),
                    definition.eventTypes().revisionOf(event),
                    definition.aggregateType(),
                    aggregateId,
                    seq,
                    correlationId,
                    causationId,
                    producer,
                    event));
        }

        try {
            List<EventEnvelope> stored = store.append(aggregateId, expectedSequence, envelopes);
            if (metrics != null) metrics.incAppended(stored.size());
            return stored;
        } catch (ConcurrencyConflictException e) {
            if (metrics != null) metrics.incConflicts();
            log.warn("Concurrency conflict aggregateType={} aggregateId={} expected={} actual={}",
                    definition.aggregateType(), aggregateId, e.getExpectedSequence(), e.getActualSequence());
            throw e;
        }
    }

    public CommandResult<S> execute(C command) {
        return execute(command, null);
    }

    public CommandResult<S> execute(C command, String correlationId) {
        String aggregateId = definition.targetId(command);
        AggregateState<S> current = load(aggregateId);

        if (definition.isCreation(command) && current.exists()) {
            throw new InvalidStateTransitionException(command.getClass().getSimpleName(), "EXISTS",
                    definition.aggregateType() + " " + aggregateId + " already exists");
        }
        if (!definition.isCreation(command) && !current.exists()) {
            throw new AggregateNotFoundException(definition.aggregateType(), aggregateId);
        }

        List<E> events = handle(current, command);
        if (events.isEmpty()) {
            return new CommandResult<>(aggregateId, current.sequence(), current.state(), List.of());
        }

        List<EventEnvelope> stored = append(aggregateId, current.sequence(), events, correlationId, null);

        S next = current.state();
        for (E event : events) {
            next = definition.reduce(next, event);
        }
        AggregateState<S> updated = current.advance(current.sequence() + events.size(), next);

        log.info("{} {} -> seq={} via {}", definition.aggregateType(), aggregateId, updated.sequence(),
                command.getClass().getSimpleName());

        publisher.publish(stored);
        snapshotter.maybeSnapshot(definition.aggregateType(), updated);

        return new CommandResult<>(aggregateId, updated.sequence(), next, stored);
    }

    public AggregateDefinition<S, C, E> definition() {
        return definition;
    }

    private AggregateState<S> fold(AggregateState<S> start, List<EventEnvelope> envelopes) {
        S state = start.state();
        long seq = start.sequence();
        for (EventEnvelope env : envelopes) {
            state = definition.reduce(state, toEvent(env));
            seq = env.getSequence();
        }
        return new AggregateState<>(start.aggregateId(), seq, start.snapshotSequence(), state);
    }

    private E toEvent(EventEnvelope env) {
        Class<? extends E> type = definition.eventTypes().classOf(env.getEventType());
        try {
            return mapper.treeToValue(env.getPayload(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read " + env.getEventType() + " eventId=" + env.getEventId()
                    + " of " + definition.aggregateType() + " " + env.getAggregateId(), e);
        }
    }
}
