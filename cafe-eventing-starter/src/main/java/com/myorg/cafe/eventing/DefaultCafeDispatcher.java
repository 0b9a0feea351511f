package com.myorg.cafe.eventing;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.exception.UnknownEventTypeException;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.slf4j.LoggerFactory;
import org.slf4j.Logger;

@Data
@AllArgsConstructor
public class DefaultCafeDispatcher implements CafeDispatcher {
    private static final Logger log = LoggerFactory.getLogger(DefaultCafeDispatcher.class);

    private final HandlerRegistry registry;
    private final boolean ignoreUnknown;

    @Override
    public void dispatch(String processingGroup, EventEnvelope env) {
        String type = env.getEventType();
        HandlerInvoker invoker = registry.get(processingGroup, type);

        if (invoker == null) {
            if (ignoreUnknown) {
                log.warn("No handler in group={} for eventType={}, eventId={}", processingGroup, type, env.getEventId());
                return;
            }
            throw new UnknownEventTypeException(processingGroup, type, env.getEventId());
        }

        invoker.invoke(env);
    }
}
