package com.myorg.cafe.eventing.idempotency;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

// Keeps records in RAM; for tests and single-instance setups.
// A daemon cleaner drops expired entries so memory stays bounded.
@Slf4j
public class InMemoryProcessingRecordStore implements ProcessingRecordStore {

    private record Entry(ProcessingRecord record, long expireAtMs) {}

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    private final Duration ttl;
    private final int maxEntries;

    private final ScheduledExecutorService cleaner;
    private final String keyPrefix; // normalized, may be ""

    public InMemoryProcessingRecordStore(Duration ttl, int maxEntries, Duration cleanupInterval) {
        this("", ttl, maxEntries, cleanupInterval);
    }

    public InMemoryProcessingRecordStore(String keyPrefix, Duration ttl, int maxEntries, Duration cleanupInterval) {
        this.ttl = requirePositive(ttl, "ttl");
        this.maxEntries = Math.max(1000, maxEntries);
        this.keyPrefix = normalizePrefix(keyPrefix);

        this.cleaner = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cafe-processing-record-cleaner");
            t.setDaemon(true);
            return t;
        });

        long periodMs = Math.max(1_000L, cleanupInterval.toMillis());
        cleaner.scheduleAtFixedRate(this::cleanupExpiredSafe, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private String key(String eventId, String processingGroup) {
        return keyPrefix + processingGroup + ":" + eventId;
    }

    @Override
    public Optional<ProcessingRecord> find(String eventId, String processingGroup) {
        String k = key(eventId, processingGroup);
        Entry e = entries.get(k);
        if (e == null) return Optional.empty();

        if (System.currentTimeMillis() > e.expireAtMs()) {
            entries.remove(k, e);
            return Optional.empty();
        }
        return Optional.of(e.record());
    }

    @Override
    public boolean insert(ProcessingRecord record) {
        String k = key(record.eventId(), record.processingGroup());
        long now = System.currentTimeMillis();
        long exp = now + ttl.toMillis();

        while (true) {
            Entry cur = entries.get(k);
            if (cur == null) {
                Entry prev = entries.putIfAbsent(k, new Entry(record, exp));
                if (prev == null) {
                    if (entries.size() > maxEntries) {
                        cleanupExpired();
                        trimToMaxEntries();
                    }
                    return true;
                }
                continue;
            }

            if (now > cur.expireAtMs()) {
                entries.remove(k, cur);
                continue;
            }
            return false;
        }
    }

    @Override
    public ProcessingRecord upsertReplay(ProcessingRecord record) {
        String k = key(record.eventId(), record.processingGroup());
        long now = System.currentTimeMillis();
        long exp = now + ttl.toMillis();

        Entry updated = entries.compute(k, (kk, cur) -> {
            if (cur == null || now > cur.expireAtMs()) {
                return new Entry(record.mergeReplay(Map.of(), record.processedAt()), exp);
            }
            return new Entry(cur.record().mergeReplay(record.headers(), record.processedAt()), exp);
        });
        return updated.record();
    }

    @Override
    public long count(String processingGroup) {
        long now = System.currentTimeMillis();
        return entries.values().stream()
                .filter(e -> now <= e.expireAtMs())
                .filter(e -> e.record().processingGroup().equals(processingGroup))
                .count();
    }

    private void cleanupExpiredSafe() {
        try {
            cleanupExpired();
        } catch (Exception e) {
            log.warn("Processing record cleanup failed", e);
        }
    }

    private void cleanupExpired() {
        long now = System.currentTimeMillis();
        Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Entry> e = it.next();
            if (now > e.getValue().expireAtMs()) {
                it.remove();
            }
        }
    }

    private void trimToMaxEntries() {
        int over = entries.size() - maxEntries;
        if (over <= 0) return;

        Iterator<String> it = entries.keySet().iterator();
        int removed = 0;
        while (it.hasNext() && removed < over) {
            it.next();
            it.remove();
            removed++;
        }
    }

    @Override
    public void close() {
        cleaner.shutdownNow();
    }

    private static Duration requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return d;
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return "";
        String p = prefix.trim();
        return p.endsWith(":") ? p : (p + ":");
    }
}
