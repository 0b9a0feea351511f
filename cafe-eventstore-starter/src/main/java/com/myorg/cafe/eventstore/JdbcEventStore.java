package com.myorg.cafe.eventstore;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.JacksonEnvelopeCodec;
import com.myorg.cafe.eventstore.exception.ConcurrencyConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Event log on a relational table. The unique (aggregate_id, seq) constraint arbitrates
 * concurrent appends.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcEventStore implements EventStore {

    private static final String EVENT_COLUMNS =
            "event_id, event_type, revision, aggregate_type, aggregate_id, seq, correlation_id, causation_id, " +
                    "occurred_at_ms, producer, headers_json, payload_json";

    private final JdbcTemplate jdbc;
    private final JacksonEnvelopeCodec codec;
    // null: each insert commits on its own
    private final TransactionTemplate tx;
    private final String eventTable;
    private final String snapshotTable;

    private String t() { return eventTable; }
    private String s() { return snapshotTable; }

    @Override
    public List<EventEnvelope> append(String aggregateId, long expectedSequence, List<EventEnvelope> envelopes) {
        if (envelopes == null || envelopes.isEmpty()) return List.of();

        long actual = lastSequence(aggregateId);
        if (actual != expectedSequence) {
            throw new ConcurrencyConflictException(aggregateId, expectedSequence, actual);
        }

        try {
            if (tx == null) {
                insertAll(envelopes);
            } else {
                tx.executeWithoutResult(status -> insertAll(envelopes));
            }
        } catch (DuplicateKeyException e) {
            throw new ConcurrencyConflictException(aggregateId, expectedSequence, lastSequence(aggregateId), e);
        }
        return envelopes;
    }

    private void insertAll(List<EventEnvelope> envelopes) {
        String sql = """
                INSERT INTO %s
                  (%s)
                VALUES
                  (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(t(), EVENT_COLUMNS);

        for (EventEnvelope env : envelopes) {
            jdbc.update(sql,
                    env.getEventId(),
                    env.getEventType(),
                    env.effectiveRevision(),
                    env.getAggregateType(),
                    env.getAggregateId(),
                    env.getSequence(),
                    env.getCorrelationId(),
                    env.getCausationId(),
                    env.getOccurredAtMs(),
                    env.getProducer(),
                    codec.headersToJson(env.getHeaders()),
                    codec.payloadToJson(env.getPayload())
            );
        }
    }

    @Override
    public List<EventEnvelope> load(String aggregateId, long afterSequence) {
        String sql = """
                SELECT %s
                FROM %s
                WHERE aggregate_id = ? AND seq > ?
                ORDER BY seq
                """.formatted(EVENT_COLUMNS, t());
        return jdbc.query(sql, envelopeMapper(), aggregateId, afterSequence);
    }

    @Override
    public void readAll(Consumer<EventEnvelope> consumer) {
        String sql = """
                SELECT %s
                FROM %s
                ORDER BY log_position
                """.formatted(EVENT_COLUMNS, t());
        RowMapper<EventEnvelope> mapper = envelopeMapper();
        jdbc.query(sql, (RowCallbackHandler) rs -> consumer.accept(mapper.mapRow(rs, rs.getRow())));
    }

    @Override
    public long lastSequence(String aggregateId) {
        Long v = jdbc.queryForObject(
                "SELECT COALESCE(MAX(seq), -1) FROM " + t() + " WHERE aggregate_id = ?", Long.class, aggregateId);
        return v == null ? -1 : v;
    }

    @Override
    public Optional<StoredSnapshot> loadSnapshot(String aggregateId) {
        String sql = """
                SELECT aggregate_id, aggregate_type, seq, state_json, created_at
                FROM %s
                WHERE aggregate_id = ?
                """.formatted(s());
        List<StoredSnapshot> rows = jdbc.query(sql, (rs, i) -> new StoredSnapshot(
                rs.getString("aggregate_id"),
                rs.getString("aggregate_type"),
                rs.getLong("seq"),
                rs.getString("state_json"),
                rs.getTimestamp("created_at").toInstant()
        ), aggregateId);
        return rows.stream().findFirst();
    }

    @Override
    public void storeSnapshot(StoredSnapshot snapshot) {
        String update = """
                UPDATE %s
                SET aggregate_type = ?, seq = ?, state_json = ?, created_at = ?
                WHERE aggregate_id = ? AND seq < ?
                """.formatted(s());
        String insert = """
                INSERT INTO %s
                  (aggregate_id, aggregate_type, seq, state_json, created_at)
                VALUES
                  (?, ?, ?, ?, ?)
                """.formatted(s());

        // two attempts: a concurrent first insert turns the second round into an update
        for (int attempt = 0; attempt < 2; attempt++) {
            int updated = jdbc.update(update,
                    snapshot.aggregateType(),
                    snapshot.sequence(),
                    snapshot.stateJson(),
                    Timestamp.from(snapshot.createdAt()),
                    snapshot.aggregateId(),
                    snapshot.sequence());
            if (updated > 0) return;

            if (loadSnapshot(snapshot.aggregateId()).isPresent()) {
                log.debug("Newer snapshot already stored for aggregateId={}", snapshot.aggregateId());
                return;
            }
            try {
                jdbc.update(insert,
                        snapshot.aggregateId(),
                        snapshot.aggregateType(),
                        snapshot.sequence(),
                        snapshot.stateJson(),
                        Timestamp.from(snapshot.createdAt()));
                return;
            } catch (DuplicateKeyException e) {
                log.debug("Concurrent snapshot insert for aggregateId={}, retrying as update", snapshot.aggregateId());
            }
        }
    }

    private RowMapper<EventEnvelope> envelopeMapper() {
        return (rs, i) -> toEnvelope(rs);
    }

    private EventEnvelope toEnvelope(ResultSet rs) throws SQLException {
        return EventEnvelope.builder()
                .eventId(rs.getString("event_id"))
                .eventType(rs.getString("event_type"))
                .revision(rs.getInt("revision"))
                .aggregateType(rs.getString("aggregate_type"))
                .aggregateId(rs.getString("aggregate_id"))
                .sequence(rs.getLong("seq"))
                .correlationId(rs.getString("correlation_id"))
                .causationId(rs.getString("causation_id"))
                .occurredAtMs(rs.getLong("occurred_at_ms"))
                .producer(rs.getString("producer"))
                .headers(codec.headersFromJson(rs.getString("headers_json")))
                .payload(codec.payloadFromJson(rs.getString("payload_json")))
                .build();
    }
}
