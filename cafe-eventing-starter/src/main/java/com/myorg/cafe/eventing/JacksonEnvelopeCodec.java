package com.myorg.cafe.eventing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.core.type.TypeReference;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of envelopes and header maps as the JDBC stores keep them.
 */
public class JacksonEnvelopeCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> HEADERS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JacksonEnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String toJson(EventEnvelope env) {
        try {
            return mapper.writeValueAsString(env);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize EventEnvelope eventId=" + env.getEventId(), e);
        }
    }

    public EventEnvelope toEnvelope(Object value) {
        if (value == null) return null;
        if (value instanceof EventEnvelope env) return env;

        try {
            if (value instanceof JsonNode node) {
                return mapper.treeToValue(node, EventEnvelope.class);
            }
            if (value instanceof String s) {
                return mapper.readValue(s, EventEnvelope.class);
            }
            return mapper.convertValue(value, EventEnvelope.class);
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    "Cannot convert stored value to EventEnvelope. valueType=" + value.getClass(), e
            );
        }
    }

    public String headersToJson(Map<String, Object> headers) {
        try {
            return mapper.writeValueAsString(headers == null ? Map.of() : headers);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize headers", e);
        }
    }

    public Map<String, Object> headersFromJson(String json) {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            return mapper.readValue(json, HEADERS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse stored headers", e);
        }
    }

    public String payloadToJson(JsonNode payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload", e);
        }
    }

    public JsonNode payloadFromJson(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse stored payload", e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
