package com.myorg.cafe.eventing;

import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.context.DispatchOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Delivers events to every processing group that has a handler for them.
 *
 * <p>Groups are isolated: a failure in one group never stops delivery to another.
 * In {@link CafeEventingProperties.DeliveryMode#ASYNC} mode each group owns a single worker
 * thread, so events of one aggregate reach a group in append order. In
 * {@link CafeEventingProperties.DeliveryMode#SYNC} mode delivery to one group is serialized by a
 * per-group lock.
 *
 * <p>{@link #exclusively} runs on the same worker (or under the same lock), so a replay never
 * interleaves with live delivery to its group.
 */
@Slf4j
public class InProcessEventPublisher implements CafePublisher, AutoCloseable {

    private final HandlerRegistry registry;
    private final CafeDispatcher dispatcher;
    private final CafeEventingProperties.DeliveryMode mode;
    private final Duration shutdownTimeout;

    private static final ThreadLocal<String> WORKER_GROUP = new ThreadLocal<>();

    private final Map<String, ExecutorService> workers = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public InProcessEventPublisher(HandlerRegistry registry,
                                   CafeDispatcher dispatcher,
                                   CafeEventingProperties.DeliveryMode mode,
                                   Duration shutdownTimeout) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.mode = mode == null ? CafeEventingProperties.DeliveryMode.SYNC : mode;
        this.shutdownTimeout = shutdownTimeout == null ? Duration.ofSeconds(10) : shutdownTimeout;
    }

    @Override
    public void publish(List<EventEnvelope> envelopes) {
        if (envelopes == null || envelopes.isEmpty()) return;

        for (String group : registry.groups()) {
            List<EventEnvelope> forGroup = envelopes.stream()
                    .filter(env -> registry.handles(group, env.getEventType()))
                    .toList();
            if (forGroup.isEmpty()) continue;

            if (mode == CafeEventingProperties.DeliveryMode.ASYNC) {
                worker(group).execute(() -> deliverAll(group, forGroup));
            } else {
                underLock(group, () -> {
                    deliverAll(group, forGroup);
                    return null;
                });
            }
        }
    }

    @Override
    public <T> T exclusively(String processingGroup, Supplier<T> task) {
        if (mode != CafeEventingProperties.DeliveryMode.ASYNC || processingGroup.equals(WORKER_GROUP.get())) {
            return underLock(processingGroup, task);
        }
        Callable<T> call = task::get;
        Future<T> result = worker(processingGroup).submit(call);
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for group " + processingGroup, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            if (e.getCause() instanceof Error err) throw err;
            throw new IllegalStateException(e.getCause());
        }
    }

    private <T> T underLock(String group, Supplier<T> task) {
        ReentrantLock lock = locks.computeIfAbsent(group, g -> new ReentrantLock());
        lock.lock();
        try {
            return task.get();
        } finally {
            lock.unlock();
        }
    }

    private void deliverAll(String group, List<EventEnvelope> envelopes) {
        for (EventEnvelope env : envelopes) {
            try {
                dispatcher.dispatch(group, env);
            } catch (RuntimeException e) {
                // only reached when no dead-letter sequencer wraps the dispatcher
                log.error("Projection failure group={} eventType={} eventId={} aggregateId={}",
                        group, env.getEventType(), env.getEventId(), env.getAggregateId(), e);
            } finally {
                DispatchOutcome.clear();
            }
        }
    }

    private ExecutorService worker(String group) {
        return workers.computeIfAbsent(group, g -> Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(() -> {
                WORKER_GROUP.set(g);
                r.run();
            }, "cafe-projection-" + g);
            t.setDaemon(true);
            return t;
        }));
    }

    @Override
    public void close() {
        workers.forEach((group, executor) -> {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Projection worker for group={} did not drain within {}", group, shutdownTimeout);
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        });
        workers.clear();
    }
}
