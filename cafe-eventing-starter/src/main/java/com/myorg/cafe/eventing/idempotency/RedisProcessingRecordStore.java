package com.myorg.cafe.eventing.idempotency;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One Redis hash per (group, eventId). Headers live in {@code h:<name>} fields, so the
 * replay upsert merges them with a plain HSET.
 */
@RequiredArgsConstructor
public class RedisProcessingRecordStore implements ProcessingRecordStore {

    private static final String HEADER_FIELD_PREFIX = "h:";

    private final StringRedisTemplate redis;
    private final Duration ttl;
    private final String keyPrefix;

    // 1=inserted, 0=already present
    private static final DefaultRedisScript<Long> INSERT_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 1 then return 0 end " +
                    "redis.call('HSET', KEYS[1], unpack(ARGV, 2)); " +
                    "redis.call('PEXPIRE', KEYS[1], ARGV[1]); " +
                    "return 1",
            Long.class
    );

    // returns 1 if the hash existed before the write
    private static final DefaultRedisScript<Long> UPSERT_SCRIPT = new DefaultRedisScript<>(
            "local existed = redis.call('EXISTS', KEYS[1]); " +
                    "if existed == 1 then " +
                    "  redis.call('HSET', KEYS[1], 'replay', 'true', 'processedAt', ARGV[2]); " +
                    "  if #ARGV > 2 then redis.call('HSET', KEYS[1], unpack(ARGV, 3)) end " +
                    "else " +
                    "  redis.call('HSET', KEYS[1], unpack(ARGV, 3)); " +
                    "  redis.call('HSET', KEYS[1], 'replay', 'true', 'processedAt', ARGV[2]); " +
                    "end " +
                    "redis.call('PEXPIRE', KEYS[1], ARGV[1]); " +
                    "return existed",
            Long.class
    );

    private String key(String eventId, String processingGroup) {
        return normalizePrefix(keyPrefix) + processingGroup + ":" + eventId;
    }

    @Override
    public Optional<ProcessingRecord> find(String eventId, String processingGroup) {
        Map<Object, Object> hash = redis.opsForHash().entries(key(eventId, processingGroup));
        if (hash == null || hash.isEmpty()) return Optional.empty();
        return Optional.of(fromHash(hash));
    }

    @Override
    public boolean insert(ProcessingRecord record) {
        List<String> args = new ArrayList<>();
        args.add(String.valueOf(ttl.toMillis()));
        args.addAll(fields(record));

        Long res = redis.execute(INSERT_SCRIPT, List.of(key(record.eventId(), record.processingGroup())), args.toArray());
        return res != null && res == 1L;
    }

    @Override
    public ProcessingRecord upsertReplay(ProcessingRecord record) {
        List<String> args = new ArrayList<>();
        args.add(String.valueOf(ttl.toMillis()));
        args.add(record.processedAt().toString());
        args.addAll(fields(record));

        redis.execute(UPSERT_SCRIPT, List.of(key(record.eventId(), record.processingGroup())), args.toArray());
        return find(record.eventId(), record.processingGroup())
                .orElseThrow(() -> new IllegalStateException("Replay record missing after upsert eventId=" + record.eventId()));
    }

    @Override
    public long count(String processingGroup) {
        Set<String> keys = redis.keys(normalizePrefix(keyPrefix) + processingGroup + ":*");
        return keys == null ? 0 : keys.size();
    }

    private static List<String> fields(ProcessingRecord r) {
        List<String> f = new ArrayList<>();
        f.add("eventId");
        f.add(r.eventId());
        f.add("processingGroup");
        f.add(r.processingGroup());
        f.add("aggregateId");
        f.add(r.aggregateId() == null ? "" : r.aggregateId());
        f.add("replay");
        f.add(String.valueOf(r.replay()));
        f.add("processedAt");
        f.add(r.processedAt().toString());
        r.headers().forEach((k, v) -> {
            f.add(HEADER_FIELD_PREFIX + k);
            f.add(String.valueOf(v));
        });
        return f;
    }

    private static ProcessingRecord fromHash(Map<Object, Object> hash) {
        Map<String, Object> headers = new LinkedHashMap<>();
        hash.forEach((k, v) -> {
            String name = String.valueOf(k);
            if (name.startsWith(HEADER_FIELD_PREFIX)) {
                headers.put(name.substring(HEADER_FIELD_PREFIX.length()), String.valueOf(v));
            }
        });
        String aggregateId = (String) hash.get("aggregateId");
        return new ProcessingRecord(
                (String) hash.get("eventId"),
                (String) hash.get("processingGroup"),
                aggregateId == null || aggregateId.isEmpty() ? null : aggregateId,
                Boolean.parseBoolean((String) hash.get("replay")),
                headers,
                Instant.parse((String) hash.get("processedAt"))
        );
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return "";
        String p = prefix.trim();
        return p.endsWith(":") ? p : (p + ":");
    }
}
