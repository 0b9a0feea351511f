package com.myorg.cafe.observability;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;

public record CafeContext(
        String eventId,
        String eventType,
        String correlationId,
        String causationId,
        String producer,
        String aggregateId,
        String processingGroup
) {
    public static CafeContext of(String processingGroup, EventEnvelope env) {
        return new CafeContext(env.getEventId(), env.getEventType(), env.getCorrelationId(), env.getCausationId(),
                env.getProducer(), env.getAggregateId(), processingGroup);
    }
}
