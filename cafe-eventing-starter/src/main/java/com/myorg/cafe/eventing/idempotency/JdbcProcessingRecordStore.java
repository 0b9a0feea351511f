package com.myorg.cafe.eventing.idempotency;

import com.myorg.cafe.eventing.JacksonEnvelopeCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Processing records in the read-model database, so a handler's writes and its record
 * commit or roll back together.
 *
 * <p>Inserts use {@code ON CONFLICT DO NOTHING}: losing a race reports an update count of zero
 * instead of a unique-key error, which on PostgreSQL would abort the surrounding transaction.
 */
@RequiredArgsConstructor
public class JdbcProcessingRecordStore implements ProcessingRecordStore {

    private final JdbcTemplate jdbc;
    private final JacksonEnvelopeCodec codec;
    private final String table;

    private String t() {
        return table;
    }

    private RowMapper<ProcessingRecord> rowMapper() {
        return (rs, i) -> new ProcessingRecord(
                rs.getString("event_id"),
                rs.getString("processing_group"),
                rs.getString("aggregate_id"),
                rs.getBoolean("is_replay"),
                codec.headersFromJson(rs.getString("headers_json")),
                rs.getTimestamp("processed_at").toInstant()
        );
    }

    @Override
    public Optional<ProcessingRecord> find(String eventId, String processingGroup) {
        String sql = """
                SELECT event_id, processing_group, aggregate_id, is_replay, headers_json, processed_at
                FROM %s
                WHERE event_id = ? AND processing_group = ?
                """.formatted(t());
        List<ProcessingRecord> rows = jdbc.query(sql, rowMapper(), eventId, processingGroup);
        return rows.stream().findFirst();
    }

    @Override
    public boolean insert(ProcessingRecord record) {
        String sql = """
                INSERT INTO %s
                  (event_id, processing_group, aggregate_id, is_replay, headers_json, processed_at)
                VALUES
                  (?, ?, ?, ?, ?, ?)
                ON CONFLICT DO NOTHING
                """.formatted(t());
        int inserted = jdbc.update(sql,
                record.eventId(),
                record.processingGroup(),
                record.aggregateId(),
                record.replay(),
                codec.headersToJson(record.headers()),
                Timestamp.from(record.processedAt())
        );
        return inserted == 1;
    }

    @Override
    public ProcessingRecord upsertReplay(ProcessingRecord record) {
        Optional<ProcessingRecord> existing = find(record.eventId(), record.processingGroup());
        if (existing.isEmpty()) {
            ProcessingRecord fresh = record.mergeReplay(null, record.processedAt());
            if (insert(fresh)) return fresh;
            // lost a race with a concurrent insert: fall through to update
            existing = find(record.eventId(), record.processingGroup());
        }

        ProcessingRecord merged = existing
                .orElseThrow(() -> new IllegalStateException("Processing record vanished eventId=" + record.eventId()))
                .mergeReplay(record.headers(), record.processedAt());

        String sql = """
                UPDATE %s
                SET is_replay = ?, headers_json = ?, processed_at = ?
                WHERE event_id = ? AND processing_group = ?
                """.formatted(t());
        jdbc.update(sql,
                true,
                codec.headersToJson(merged.headers()),
                Timestamp.from(merged.processedAt()),
                merged.eventId(),
                merged.processingGroup()
        );
        return merged;
    }

    @Override
    public long count(String processingGroup) {
        Long v = jdbc.queryForObject(
                "SELECT COUNT(*) FROM " + t() + " WHERE processing_group = ?", Long.class, processingGroup);
        return v == null ? 0 : v;
    }

    @Override
    public boolean transactional() {
        return true;
    }
}
