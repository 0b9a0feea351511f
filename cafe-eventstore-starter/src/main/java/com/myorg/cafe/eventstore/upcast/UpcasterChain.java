package com.myorg.cafe.eventstore.upcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventstore.exception.UpcastFailureException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies upcasters until the payload reaches the newest revision any rule knows of.
 * Current payloads pass through untouched; stored data is never modified.
 */
@Slf4j
public class UpcasterChain {

    private final Map<String, EventUpcaster> rules = new LinkedHashMap<>();

    public UpcasterChain(Collection<? extends EventUpcaster> upcasters) {
        for (EventUpcaster u : upcasters) {
            String key = key(u.eventType(), u.sourceRevision());
            EventUpcaster prev = rules.putIfAbsent(key, u);
            if (prev != null) {
                throw new IllegalStateException("Duplicate upcaster for " + key + ": "
                        + prev.getClass().getName() + " and " + u.getClass().getName());
            }
        }
        log.info("Upcaster chain ready with {} rule(s) {}", rules.size(), rules.keySet());
    }

    public static UpcasterChain empty() {
        return new UpcasterChain(List.of());
    }

    public EventEnvelope upcast(EventEnvelope env) {
        int revision = env.effectiveRevision();
        EventUpcaster rule = rules.get(key(env.getEventType(), revision));
        if (rule == null) return env;

        JsonNode payload = env.getPayload() == null ? null : env.getPayload().deepCopy();
        while (rule != null) {
            if (!(payload instanceof ObjectNode obj)) {
                throw new UpcastFailureException(env.getEventType(), revision, env.getEventId(),
                        "payload is not a JSON object");
            }
            try {
                payload = rule.upcast(obj);
            } catch (UpcastFailureException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new UpcastFailureException(env.getEventType(), revision, env.getEventId(), e);
            }
            revision++;
            rule = rules.get(key(env.getEventType(), revision));
        }

        return env.toBuilder()
                .revision(revision)
                .headers(new LinkedHashMap<>(env.getHeaders() == null ? Map.of() : env.getHeaders()))
                .payload(payload)
                .build();
    }

    public int size() {
        return rules.size();
    }

    private static String key(String eventType, int revision) {
        return eventType + "@" + revision;
    }
}
