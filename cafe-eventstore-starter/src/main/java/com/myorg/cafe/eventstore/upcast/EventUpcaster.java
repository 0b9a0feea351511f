package com.myorg.cafe.eventstore.upcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Rewrites one stored payload shape into the next revision of the same event type.
 * Implementations receive a private copy of the payload and may mutate it.
 */
public interface EventUpcaster {

    String eventType();

    /** Revision this rule reads; it produces {@code sourceRevision() + 1}. */
    int sourceRevision();

    default boolean canUpcast(String eventType, int revision) {
        return eventType().equals(eventType) && sourceRevision() == revision;
    }

    JsonNode upcast(ObjectNode payload);
}
