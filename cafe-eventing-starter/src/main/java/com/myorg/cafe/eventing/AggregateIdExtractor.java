package com.myorg.cafe.eventing;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.cafe.contracts.core.conventions.CoreHeaders;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import lombok.RequiredArgsConstructor;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves the entity an event belongs to.
 *
 * <p>Order: the function registered for the event type, then the {@code entityId},
 * {@code aggregateId} and {@code cafe-aggregate-id} headers, then the envelope's aggregate id,
 * then a payload field named {@code id} or the first one ending in {@code Id}.
 */
@RequiredArgsConstructor
public class AggregateIdExtractor {

    private static final List<String> HEADER_KEYS = List.of(
            CoreHeaders.ENTITY_ID,
            CoreHeaders.AGGREGATE_ID,
            CoreHeaders.CAFE_AGGREGATE_ID
    );

    private final HandlerRegistry registry;

    public Optional<String> extract(EventEnvelope env) {
        Function<JsonNode, String> explicit = registry.idExtractor(env.getEventType());
        if (explicit != null && env.getPayload() != null) {
            String id = explicit.apply(env.getPayload());
            if (hasText(id)) return Optional.of(id);
        }

        Map<String, Object> headers = env.getHeaders();
        if (headers != null) {
            for (String key : HEADER_KEYS) {
                Object v = headers.get(key);
                if (v != null && hasText(v.toString())) return Optional.of(v.toString());
            }
        }

        if (hasText(env.getAggregateId())) return Optional.of(env.getAggregateId());

        return fromPayload(env.getPayload());
    }

    private static Optional<String> fromPayload(JsonNode payload) {
        if (payload == null || !payload.isObject()) return Optional.empty();

        JsonNode id = payload.get("id");
        if (id != null && id.isValueNode() && hasText(id.asText())) return Optional.of(id.asText());

        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            if (f.getKey().endsWith("Id") && f.getValue().isValueNode() && hasText(f.getValue().asText())) {
                return Optional.of(f.getValue().asText());
            }
        }
        return Optional.empty();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
