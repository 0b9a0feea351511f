package com.myorg.cafe.contracts.core.conventions;

public final class CoreHeaders {
    private CoreHeaders() {}

    // entity id hints, checked in this order
    public static final String ENTITY_ID = "entityId";
    public static final String AGGREGATE_ID = "aggregateId";
    public static final String CAFE_AGGREGATE_ID = "cafe-aggregate-id";

    public static final String REPLAY = "cafe-replay";
    public static final String CORRELATION_ID = "cafe-correlation-id";
    public static final String DEAD_LETTER_REDRIVE = "cafe-dead-letter-redrive";

    public static boolean isTrue(Object headerValue) {
        if (headerValue instanceof Boolean b) return b;
        return headerValue != null && "true".equalsIgnoreCase(headerValue.toString().trim());
    }
}
