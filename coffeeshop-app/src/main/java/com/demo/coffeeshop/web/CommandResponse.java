package com.demo.coffeeshop.web;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventstore.aggregate.CommandResult;

import java.util.List;

public record CommandResponse(String id, long sequence, List<String> events) {

    public static CommandResponse of(CommandResult<?> result) {
        return new CommandResponse(result.aggregateId(), result.sequence(),
                result.events().stream().map(EventEnvelope::getEventType).toList());
    }
}
