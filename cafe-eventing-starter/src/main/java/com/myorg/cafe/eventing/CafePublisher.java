package com.myorg.cafe.eventing;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;

import java.util.List;
import java.util.function.Supplier;

/**
 * Hands freshly appended events to the processing groups.
 */
public interface CafePublisher {
    void publish(List<EventEnvelope> envelopes);

    /**
     * Runs {@code task} while live delivery to {@code processingGroup} is held back. Events published
     * meanwhile reach the group after the task returns, in publish order.
     */
    default <T> T exclusively(String processingGroup, Supplier<T> task) {
        return task.get();
    }
}
