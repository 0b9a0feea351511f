package com.myorg.cafe.eventstore.exception;

import com.myorg.cafe.contracts.core.exception.CafeNonRetryableException;
import lombok.Getter;

@Getter
public class AggregateNotFoundException extends CafeNonRetryableException {
    private final String aggregateType;
    private final String aggregateId;

    public AggregateNotFoundException(String aggregateType, String aggregateId) {
        super("AGGREGATE_NOT_FOUND", aggregateType + " " + aggregateId + " does not exist");
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }
}
