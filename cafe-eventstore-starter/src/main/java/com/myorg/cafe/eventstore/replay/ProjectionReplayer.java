package com.myorg.cafe.eventstore.replay;

import com.myorg.cafe.contracts.core.conventions.CoreHeaders;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.CafeDispatcher;
import com.myorg.cafe.eventing.CafePublisher;
import com.myorg.cafe.eventing.HandlerRegistry;
import com.myorg.cafe.eventing.context.DispatchOutcome;
import com.myorg.cafe.eventstore.EventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rebuilds one processing group's read model: reset, then every stored event the group
 * handles, in append order and flagged as replay.
 *
 * <p>The rebuild runs through {@link CafePublisher#exclusively}, so events appended while it runs
 * are delivered live only after it finishes and find the rebuilt read model.
 */
@Slf4j
@RequiredArgsConstructor
public class ProjectionReplayer {
    private final EventStore store;
    private final HandlerRegistry registry;
    private final CafeDispatcher dispatcher;
    private final CafePublisher publisher;

    public record ReplayResult(String processingGroup, long dispatched) {}

    public ReplayResult replay(String processingGroup) {
        if (!registry.groups().contains(processingGroup)) {
            throw new IllegalArgumentException("Unknown processing group " + processingGroup);
        }
        return publisher.exclusively(processingGroup, () -> rebuild(processingGroup));
    }

    private ReplayResult rebuild(String processingGroup) {
        Runnable reset = registry.resetHandler(processingGroup);
        if (reset != null) {
            reset.run();
        } else {
            log.warn("Group {} has no reset handler; replay runs over the existing read model", processingGroup);
        }

        AtomicLong dispatched = new AtomicLong();
        store.readAll(env -> {
            if (!registry.handles(processingGroup, env.getEventType())) return;

            try {
                dispatcher.dispatch(processingGroup, asReplay(env));
                dispatched.incrementAndGet();
            } finally {
                DispatchOutcome.clear();
            }
        });

        log.info("Replayed group={} dispatched={}", processingGroup, dispatched.get());
        return new ReplayResult(processingGroup, dispatched.get());
    }

    private static EventEnvelope asReplay(EventEnvelope env) {
        Map<String, Object> headers = new LinkedHashMap<>(env.getHeaders() == null ? Map.of() : env.getHeaders());
        headers.put(CoreHeaders.REPLAY, true);
        return env.toBuilder().headers(headers).build();
    }
}
