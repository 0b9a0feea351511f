package com.myorg.cafe.deadletter;

import com.myorg.cafe.contracts.core.envelope.ErrorInfo;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public interface DeadLetterQueue {

    DeadLetter enqueue(String processingGroup, String sequenceKey, EventEnvelope envelope, ErrorInfo cause,
                       Instant now, Map<String, Object> diagnostics);

    boolean contains(String processingGroup, String sequenceKey);

    /** Oldest letter of every sequence in the group, ordered by enqueue order. */
    List<DeadLetter> heads(String processingGroup);

    /** All letters of the group in enqueue order. */
    List<DeadLetter> letters(String processingGroup);

    void markRetry(long id, int retryCount, DeadLetter.Status status, Instant nextAttemptAt, ErrorInfo cause, Instant now);

    boolean evict(long id);

    long size(String processingGroup);

    /** Letters across all groups still eligible for scheduled redrive. */
    long countQueued();
}
