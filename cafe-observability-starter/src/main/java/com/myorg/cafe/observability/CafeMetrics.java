package com.myorg.cafe.observability;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class CafeMetrics {

    private final MeterRegistry registry;
    private final String serviceName;
    private final CafeObservabilityProperties props;

    private Counter cHandledSuccess;
    private Counter cHandledFail;
    private Counter cDuplicate;
    private Counter cReplayed;
    private Counter cDeadLettered;

    /** Call once on startup. */
    public void preRegisterBaseMeters() {
        cHandledSuccess = Counter.builder("cafe.event.handled.success").tag("service", serviceName).register(registry);
        cHandledFail    = Counter.builder("cafe.event.handled.fail").tag("service", serviceName).register(registry);
        cDuplicate      = Counter.builder("cafe.event.duplicate").tag("service", serviceName).register(registry);
        cReplayed       = Counter.builder("cafe.event.replayed").tag("service", serviceName).register(registry);
        cDeadLettered   = Counter.builder("cafe.event.dead_lettered").tag("service", serviceName).register(registry);

        Timer.builder("cafe.event.processing").tag("service", serviceName).register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample, String processingGroup, EventEnvelope env, String outcome) {
        if (sample == null) return;

        Timer.Builder b = Timer.builder("cafe.event.processing")
                .tag("service", serviceName);

        if (props.isTagOutcome()) b.tag("outcome", outcome);
        if (props.isTagEventType() && env != null && env.getEventType() != null) b.tag("eventType", env.getEventType());
        if (props.isTagProcessingGroup() && processingGroup != null) b.tag("group", processingGroup);

        sample.stop(b.register(registry));
    }

    public void incHandledSuccess() { if (cHandledSuccess != null) cHandledSuccess.increment(); }
    public void incHandledFail()    { if (cHandledFail != null) cHandledFail.increment(); }
    public void incDuplicate()      { if (cDuplicate != null) cDuplicate.increment(); }
    public void incReplayed()       { if (cReplayed != null) cReplayed.increment(); }
    public void incDeadLettered()   { if (cDeadLettered != null) cDeadLettered.increment(); }
}
