package com.myorg.cafe.eventing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Typed handler bound to one event type: converts the JSON payload and calls the handler.
 */
@Data
@AllArgsConstructor
public class HandlerInvoker {
    private final String eventType;
    private final Class<?> payloadClass;
    private final EventHandler<Object> handler;
    private final ObjectMapper mapper;

    public void invoke(EventEnvelope env) {
        Object payloadObj;
        try {
            payloadObj = mapper.treeToValue(env.getPayload(), payloadClass);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Cannot convert payload of eventType=" + eventType + " to " + payloadClass.getName(), e);
        }
        handler.handle(env, payloadObj);
    }

    @FunctionalInterface
    public interface EventHandler<P> {
        void handle(EventEnvelope env, P payload);
    }
}
