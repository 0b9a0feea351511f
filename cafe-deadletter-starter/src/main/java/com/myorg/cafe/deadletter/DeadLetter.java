package com.myorg.cafe.deadletter;

import com.myorg.cafe.contracts.core.envelope.ErrorInfo;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;

import java.time.Instant;
import java.util.Map;

/**
 * An event parked for one processing group, queued behind earlier letters of the same sequence.
 */
public record DeadLetter(
        long id,
        String processingGroup,
        String sequenceKey,
        EventEnvelope envelope,
        ErrorInfo cause,
        Status status,
        int retryCount,
        Instant enqueuedAt,
        Instant lastTouched,
        Instant nextAttemptAt,
        Map<String, Object> diagnostics
) {
    public enum Status {
        QUEUED,
        // retries used up: still blocks its sequence, only manual processing touches it
        EXHAUSTED
    }

    public boolean isDue(Instant now) {
        return status == Status.QUEUED && !nextAttemptAt.isAfter(now);
    }
}
