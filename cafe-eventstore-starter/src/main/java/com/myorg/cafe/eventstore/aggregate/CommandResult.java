package com.myorg.cafe.eventstore.aggregate;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;

import java.util.List;

public record CommandResult<S>(String aggregateId, long sequence, S state, List<EventEnvelope> events) {
}
