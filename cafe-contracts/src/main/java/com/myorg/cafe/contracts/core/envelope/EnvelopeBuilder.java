package com.myorg.cafe.contracts.core.envelope;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.cafe.contracts.core.conventions.CoreHeaders;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@UtilityClass
public class EnvelopeBuilder {
    // every stored event carries the same metadata shape
    public static EventEnvelope wrap(ObjectMapper mapper,
                                     String eventType,
                                     int revision,
                                     String aggregateType,
                                     String aggregateId,
                                     long sequence,
                                     String correlationId,
                                     String causationId,
                                     String producer,
                                     Object payloadObj
                                     ){
        Map<String, Object> headers = new LinkedHashMap<>();
        headers.put(CoreHeaders.AGGREGATE_ID, aggregateId);
        if (correlationId != null) headers.put(CoreHeaders.CORRELATION_ID, correlationId);

        return EventEnvelope.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .revision(revision)
                .aggregateType(aggregateType)
                .aggregateId(aggregateId)
                .sequence(sequence)
                .correlationId(correlationId)
                .causationId(causationId)
                .occurredAtMs(System.currentTimeMillis())
                .producer(producer)
                .headers(headers)
                .payload(mapper.valueToTree(payloadObj))
                .build();
    }
}
