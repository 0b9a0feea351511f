package com.myorg.cafe.contracts.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EventEnvelope {
    private String eventId; // UUID
    private String eventType;  // e.g. "coffeeshop.order.created"
    private int revision;  // payload schema revision, 0 means "not tagged" (treated as 1)

    private String aggregateType; // order / payment / product
    private String aggregateId;
    private long sequence; // per aggregate, starts at 0

    private String correlationId;
    private String causationId;

    private long occurredAtMs; // epoch millis
    private String producer;

    @Builder.Default
    private Map<String, Object> headers = new LinkedHashMap<>();

    private JsonNode payload;

    public int effectiveRevision() {
        return revision <= 0 ? 1 : revision;
    }

    public Object header(String name) {
        return headers == null ? null : headers.get(name);
    }
}
