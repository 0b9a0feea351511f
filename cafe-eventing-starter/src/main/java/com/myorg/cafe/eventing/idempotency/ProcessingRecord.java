package com.myorg.cafe.eventing.idempotency;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Proof that a processing group applied an event. Unique per (eventId, processingGroup).
 */
public record ProcessingRecord(
        String eventId,
        String processingGroup,
        String aggregateId,
        boolean replay,
        Map<String, Object> headers,
        Instant processedAt
) {
    public ProcessingRecord {
        headers = headers == null ? Map.of() : Map.copyOf(withoutNulls(headers));
    }

    /** Replay variant: flag set, current headers merged over the stored ones. */
    public ProcessingRecord mergeReplay(Map<String, Object> currentHeaders, Instant now) {
        Map<String, Object> merged = new LinkedHashMap<>(headers);
        if (currentHeaders != null) merged.putAll(withoutNulls(currentHeaders));
        return new ProcessingRecord(eventId, processingGroup, aggregateId, true, merged, now);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> in) {
        Map<String, Object> out = new LinkedHashMap<>();
        in.forEach((k, v) -> {
            if (k != null && v != null) out.put(k, v);
        });
        return out;
    }
}
