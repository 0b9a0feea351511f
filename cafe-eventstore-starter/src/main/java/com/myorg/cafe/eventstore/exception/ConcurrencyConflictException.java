package com.myorg.cafe.eventstore.exception;

import com.myorg.cafe.eventing.exception.CafeRetryableException;
import lombok.Getter;

/**
 * Another writer appended to the aggregate first. The caller may reload and retry.
 */
@Getter
public class ConcurrencyConflictException extends CafeRetryableException {
    private final String aggregateId;
    private final long expectedSequence;
    private final long actualSequence;

    public ConcurrencyConflictException(String aggregateId, long expectedSequence, long actualSequence) {
        this(aggregateId, expectedSequence, actualSequence, null);
    }

    public ConcurrencyConflictException(String aggregateId, long expectedSequence, long actualSequence, Throwable cause) {
        super("Concurrent modification of aggregate " + aggregateId
                + ": expected sequence " + expectedSequence + " but was " + actualSequence, cause);
        this.aggregateId = aggregateId;
        this.expectedSequence = expectedSequence;
        this.actualSequence = actualSequence;
    }
}
