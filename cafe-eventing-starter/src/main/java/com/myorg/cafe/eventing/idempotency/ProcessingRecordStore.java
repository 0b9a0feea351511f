package com.myorg.cafe.eventing.idempotency;

import java.util.Optional;

/**
 * Keyed store of {@link ProcessingRecord}s used by {@code IdempotentCafeDispatcher}.
 *
 * <p>Only a store that writes through the read model's transaction can make the handler's
 * effects and the record commit together; see {@link #transactional()}.
 */
public interface ProcessingRecordStore extends AutoCloseable {

    Optional<ProcessingRecord> find(String eventId, String processingGroup);

    /**
     * Insert a new record.
     *
     * @return {@code false} if a record for (eventId, processingGroup) already existed
     */
    boolean insert(ProcessingRecord record);

    /**
     * Create or update the record for a replayed event. An existing record keeps its identity,
     * gets {@code replay=true} and has the given headers merged into its own.
     */
    ProcessingRecord upsertReplay(ProcessingRecord record);

    long count(String processingGroup);

    /** Whether writes join the caller's JDBC transaction. */
    default boolean transactional() {
        return false;
    }

    @Override
    default void close() {
        // no-op by default
    }
}
