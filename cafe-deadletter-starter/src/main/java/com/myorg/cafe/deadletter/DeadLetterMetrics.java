package com.myorg.cafe.deadletter;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class DeadLetterMetrics {

    private final MeterRegistry registry;
    private final DeadLetterQueue queue;

    private Counter enqueued;
    private Counter redriveSuccess;
    private Counter redriveFail;

    public void preRegister() {
        enqueued = Counter.builder("cafe.deadletter.enqueued").register(registry);
        redriveSuccess = Counter.builder("cafe.deadletter.redrive.success").register(registry);
        redriveFail = Counter.builder("cafe.deadletter.redrive.fail").register(registry);

        registry.gauge("cafe.deadletter.queued", queue, DeadLetterQueue::countQueued);
    }

    public void incEnqueued() { if (enqueued != null) enqueued.increment(); }
    public void incRedriveSuccess() { if (redriveSuccess != null) redriveSuccess.increment(); }
    public void incRedriveFail() { if (redriveFail != null) redriveFail.increment(); }
}
