package com.myorg.cafe.deadletter;

import com.myorg.cafe.contracts.core.envelope.ErrorInfo;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.AggregateIdExtractor;
import com.myorg.cafe.eventing.CafeDispatcher;
import com.myorg.cafe.eventing.context.DispatchOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps per-entity ordering when a handler fails: the failed event and every later event of
 * the same sequence are parked in the dead-letter queue instead of being delivered.
 * Failures never propagate to the publisher.
 */
@Slf4j
@RequiredArgsConstructor
public class SequencingCafeDispatcher implements CafeDispatcher {

    private final CafeDispatcher delegate;
    private final DeadLetterSequencer sequencer;
    private final AggregateIdExtractor idExtractor;

    @Override
    public void dispatch(String processingGroup, EventEnvelope env) {
        String sequenceKey = sequenceKey(env);

        if (sequencer.isBlocked(processingGroup, sequenceKey)) {
            sequencer.enqueue(processingGroup, sequenceKey, env, ErrorInfo.of(DeadLetterSequencer.SEQUENCE_BLOCKED,
                    "Earlier event of sequence " + sequenceKey + " is dead-lettered"));
            DispatchOutcome.markDeadLettered();
            return;
        }

        try {
            sequencer.invoke(processingGroup, env, delegate);
        } catch (RuntimeException e) {
            sequencer.enqueue(processingGroup, sequenceKey, env, DeadLetterSequencer.causeOf(e));
            log.debug("Handler failure parked group={} eventId={}", processingGroup, env.getEventId(), e);
            DispatchOutcome.markDeadLettered();
        }
    }

    private String sequenceKey(EventEnvelope env) {
        return idExtractor.extract(env).orElse(env.getEventId());
    }
}
