package com.myorg.cafe.deadletter;

import com.myorg.cafe.contracts.core.envelope.ErrorInfo;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.JacksonEnvelopeCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
public class JdbcDeadLetterQueue implements DeadLetterQueue {

    private static final String COLUMNS = """
            id, processing_group, sequence_key, envelope_json, status, retry_count,
            cause_code, cause_message, cause_detail, diagnostics_json,
            enqueued_at, last_touched, next_attempt_at""";

    private final JdbcTemplate jdbc;
    private final JacksonEnvelopeCodec codec;
    private final String table;

    private String t() { return table; }

    private RowMapper<DeadLetter> rowMapper() {
        return (rs, i) -> new DeadLetter(
                rs.getLong("id"),
                rs.getString("processing_group"),
                rs.getString("sequence_key"),
                codec.toEnvelope(rs.getString("envelope_json")),
                new ErrorInfo(rs.getString("cause_code"), rs.getString("cause_message"), rs.getString("cause_detail")),
                DeadLetter.Status.valueOf(rs.getString("status")),
                rs.getInt("retry_count"),
                rs.getTimestamp("enqueued_at").toInstant(),
                rs.getTimestamp("last_touched").toInstant(),
                rs.getTimestamp("next_attempt_at").toInstant(),
                codec.headersFromJson(rs.getString("diagnostics_json"))
        );
    }

    @Override
    public DeadLetter enqueue(String processingGroup, String sequenceKey, EventEnvelope envelope, ErrorInfo cause,
                              Instant now, Map<String, Object> diagnostics) {
        String sql = """
                INSERT INTO %s
                  (processing_group, sequence_key, event_id, event_type, envelope_json, status, retry_count,
                   cause_code, cause_message, cause_detail, diagnostics_json, enqueued_at, last_touched, next_attempt_at)
                VALUES
                  (?, ?, ?, ?, ?, ?, 0, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(t());

        String envelopeJson = codec.toJson(envelope);
        String diagnosticsJson = codec.headersToJson(diagnostics);
        Timestamp ts = Timestamp.from(now);

        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, processingGroup);
            ps.setString(2, sequenceKey);
            ps.setString(3, envelope.getEventId());
            ps.setString(4, envelope.getEventType());
            ps.setString(5, envelopeJson);
            ps.setString(6, DeadLetter.Status.QUEUED.name());
            ps.setString(7, cause.getCode());
            ps.setString(8, cause.getMessage());
            ps.setString(9, cause.getDetail());
            ps.setString(10, diagnosticsJson);
            ps.setTimestamp(11, ts);
            ps.setTimestamp(12, ts);
            ps.setTimestamp(13, ts);
            return ps;
        }, keys);

        Number id = keys.getKey();
        if (id == null) throw new IllegalStateException("No id returned from dead letter insert");
        return new DeadLetter(id.longValue(), processingGroup, sequenceKey, envelope, cause,
                DeadLetter.Status.QUEUED, 0, now, now, now, diagnostics == null ? Map.of() : diagnostics);
    }

    @Override
    public boolean contains(String processingGroup, String sequenceKey) {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM " + t() + " WHERE processing_group = ? AND sequence_key = ?",
                Integer.class, processingGroup, sequenceKey);
        return n != null && n > 0;
    }

    @Override
    public List<DeadLetter> heads(String processingGroup) {
        String sql = """
                SELECT %s
                FROM %s
                WHERE id IN (
                    SELECT MIN(id) FROM %s WHERE processing_group = ? GROUP BY sequence_key
                )
                ORDER BY id
                """.formatted(COLUMNS, t(), t());
        return jdbc.query(sql, rowMapper(), processingGroup);
    }

    @Override
    public List<DeadLetter> letters(String processingGroup) {
        String sql = """
                SELECT %s
                FROM %s
                WHERE processing_group = ?
                ORDER BY id
                """.formatted(COLUMNS, t());
        return jdbc.query(sql, rowMapper(), processingGroup);
    }

    @Override
    public void markRetry(long id, int retryCount, DeadLetter.Status status, Instant nextAttemptAt,
                          ErrorInfo cause, Instant now) {
        String sql = """
                UPDATE %s
                SET retry_count = ?, status = ?, next_attempt_at = ?, last_touched = ?,
                    cause_code = ?, cause_message = ?, cause_detail = ?
                WHERE id = ?
                """.formatted(t());
        jdbc.update(sql,
                retryCount,
                status.name(),
                Timestamp.from(nextAttemptAt),
                Timestamp.from(now),
                cause.getCode(),
                cause.getMessage(),
                cause.getDetail(),
                id);
    }

    @Override
    public boolean evict(long id) {
        return jdbc.update("DELETE FROM " + t() + " WHERE id = ?", id) > 0;
    }

    @Override
    public long size(String processingGroup) {
        Long n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM " + t() + " WHERE processing_group = ?", Long.class, processingGroup);
        return n == null ? 0 : n;
    }

    @Override
    public long countQueued() {
        Long n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM " + t() + " WHERE status = ?", Long.class, DeadLetter.Status.QUEUED.name());
        return n == null ? 0 : n;
    }
}
