package com.myorg.cafe.eventing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Explicit table of projection handlers, keyed by processing group and event type.
 * Filled once at startup from {@link ProjectionRegistration} beans.
 */
public class HandlerRegistry {
    private final Map<String, Map<String, HandlerInvoker>> handlers = new ConcurrentHashMap<>();
    private final Map<String, Runnable> resetHandlers = new ConcurrentHashMap<>();
    private final Map<String, Function<JsonNode, String>> idExtractors = new ConcurrentHashMap<>();
    private final Set<String> groups = Collections.synchronizedSet(new LinkedHashSet<>());
    private final ObjectMapper mapper;

    public HandlerRegistry(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @SuppressWarnings("unchecked")
    public <P> void register(String processingGroup, String eventType, Class<P> payloadClass,
                             HandlerInvoker.EventHandler<? super P> handler) {
        HandlerInvoker invoker = new HandlerInvoker(eventType, payloadClass,
                (HandlerInvoker.EventHandler<Object>) handler, mapper);
        HandlerInvoker prev = handlers.computeIfAbsent(processingGroup, g -> new ConcurrentHashMap<>())
                .putIfAbsent(eventType, invoker);
        if (prev != null) {
            throw new IllegalStateException(
                    "Duplicate handler in group=" + processingGroup + " for eventType=" + eventType);
        }
        groups.add(processingGroup);
    }

    /** Clears the group's read model before a replay from the start of the log. */
    public void registerReset(String processingGroup, Runnable reset) {
        resetHandlers.put(processingGroup, reset);
        groups.add(processingGroup);
    }

    /** Explicit entity-id function for an event type, used by the idempotency guard. */
    public void registerIdExtractor(String eventType, Function<JsonNode, String> extractor) {
        idExtractors.put(eventType, extractor);
    }

    public Function<JsonNode, String> idExtractor(String eventType) {
        return idExtractors.get(eventType);
    }

    public HandlerInvoker get(String processingGroup, String eventType) {
        Map<String, HandlerInvoker> byType = handlers.get(processingGroup);
        return byType == null ? null : byType.get(eventType);
    }

    public boolean handles(String processingGroup, String eventType) {
        return get(processingGroup, eventType) != null;
    }

    public Runnable resetHandler(String processingGroup) {
        return resetHandlers.get(processingGroup);
    }

    public Set<String> groups() {
        synchronized (groups) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(groups));
        }
    }
}
