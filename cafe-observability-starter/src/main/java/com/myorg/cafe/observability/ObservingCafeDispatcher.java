package com.myorg.cafe.observability;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.CafeDispatcher;
import com.myorg.cafe.eventing.context.DispatchOutcome;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

/**
 * Outermost dispatcher layer: MDC for the handler's log lines plus outcome counters and timer.
 */
@RequiredArgsConstructor
public class ObservingCafeDispatcher implements CafeDispatcher {

    private final CafeDispatcher delegate;
    private final CafeObservabilityProperties props;
    private final CafeMetrics metrics; // can be null if metrics disabled

    @Override
    public void dispatch(String processingGroup, EventEnvelope env) {
        if (props.isMdcEnabled() && env != null) {
            CafeMdc.put(CafeContext.of(processingGroup, env));
        }

        boolean measure = metrics != null && props.isMetricsEnabled();
        Timer.Sample sample = measure ? metrics.startTimer() : null;

        try {
            delegate.dispatch(processingGroup, env);

            if (measure) {
                String outcome = DispatchOutcome.consume();
                if (outcome == null) outcome = "success";

                switch (outcome) {
                    case DispatchOutcome.DUPLICATE -> metrics.incDuplicate();
                    case DispatchOutcome.REPLAYED -> metrics.incReplayed();
                    case DispatchOutcome.DEAD_LETTERED -> metrics.incDeadLettered();
                    default -> metrics.incHandledSuccess();
                }

                metrics.stopTimer(sample, processingGroup, env, outcome);
            }
        } catch (RuntimeException e) {
            if (measure) {
                metrics.incHandledFail();
                metrics.stopTimer(sample, processingGroup, env, "fail");
            }
            throw e;
        } finally {
            // safety net
            DispatchOutcome.clear();
            if (props.isMdcEnabled()) {
                CafeMdc.clear();
            }
        }
    }
}
