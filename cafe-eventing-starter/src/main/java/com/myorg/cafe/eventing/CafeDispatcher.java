package com.myorg.cafe.eventing;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;

/**
 * Delivers one event to the handler registered for it in one processing group.
 * Decorators (idempotency, dead-letter sequencing, observability) wrap this contract.
 */
public interface CafeDispatcher {
    void dispatch(String processingGroup, EventEnvelope env);
}
