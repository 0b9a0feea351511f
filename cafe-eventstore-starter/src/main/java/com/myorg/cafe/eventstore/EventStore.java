package com.myorg.cafe.eventstore;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Append-only event log with optimistic concurrency, plus the latest snapshot per aggregate.
 */
public interface EventStore {

    /**
     * Appends envelopes whose sequences continue from {@code expectedSequence}.
     *
     * @throws com.myorg.cafe.eventstore.exception.ConcurrencyConflictException when another writer
     *         already used one of the sequences
     */
    List<EventEnvelope> append(String aggregateId, long expectedSequence, List<EventEnvelope> envelopes);

    /** Events of one aggregate with sequence greater than {@code afterSequence}, in sequence order. */
    List<EventEnvelope> load(String aggregateId, long afterSequence);

    /** Every stored event in append order. */
    void readAll(Consumer<EventEnvelope> consumer);

    /** -1 when the aggregate has no events. */
    long lastSequence(String aggregateId);

    Optional<StoredSnapshot> loadSnapshot(String aggregateId);

    /** Replaces the aggregate's snapshot unless the stored one is newer. */
    void storeSnapshot(StoredSnapshot snapshot);
}
