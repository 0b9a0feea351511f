package com.myorg.cafe.observability;

import org.slf4j.MDC;

import java.util.List;

public final class CafeMdc {

    public static final String EVENT_ID = "eventId";
    public static final String EVENT_TYPE = "eventType";
    public static final String CORRELATION_ID = "corrId";
    public static final String CAUSATION_ID = "causationId";
    public static final String PRODUCER = "producer";
    public static final String AGGREGATE_ID = "aggregateId";
    public static final String PROCESSING_GROUP = "group";

    private static final List<String> KEYS = List.of(
            EVENT_ID, EVENT_TYPE, CORRELATION_ID, CAUSATION_ID, PRODUCER, AGGREGATE_ID, PROCESSING_GROUP);

    private CafeMdc() {}

    public static void put(CafeContext c) {
        if (c == null) return;
        if (c.eventId() != null) MDC.put(EVENT_ID, c.eventId());
        if (c.eventType() != null) MDC.put(EVENT_TYPE, c.eventType());
        if (c.correlationId() != null) MDC.put(CORRELATION_ID, c.correlationId());
        if (c.causationId() != null) MDC.put(CAUSATION_ID, c.causationId());
        if (c.producer() != null) MDC.put(PRODUCER, c.producer());
        if (c.aggregateId() != null) MDC.put(AGGREGATE_ID, c.aggregateId());
        if (c.processingGroup() != null) MDC.put(PROCESSING_GROUP, c.processingGroup());
    }

    public static void clear() {
        KEYS.forEach(MDC::remove);
    }
}
