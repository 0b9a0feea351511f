package com.myorg.cafe.eventing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class InProcessEventPublisherTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HandlerRegistry registry = new HandlerRegistry(mapper);
    private InProcessEventPublisher publisher;

    @AfterEach
    void tearDown() {
        if (publisher != null) publisher.close();
    }

    private EventEnvelope event(String type, long seq) {
        ObjectNode payload = mapper.createObjectNode().put("id", "A1").put("n", seq);
        return EventEnvelope.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .aggregateId("A1")
                .sequence(seq)
                .payload(payload)
                .build();
    }

    private InProcessEventPublisher publisher(CafeEventingProperties.DeliveryMode mode) {
        publisher = new InProcessEventPublisher(registry, new DefaultCafeDispatcher(registry, true), mode,
                Duration.ofSeconds(2));
        return publisher;
    }

    @Test
    void asyncDeliveryKeepsAppendOrderPerGroup() {
        List<Long> seen = new CopyOnWriteArrayList<>();
        registry.register("kitchen", "test.ticket", ObjectNode.class, (env, p) -> seen.add(p.get("n").asLong()));

        var pub = publisher(CafeEventingProperties.DeliveryMode.ASYNC);
        IntStream.range(0, 50).forEach(i -> pub.publish(List.of(event("test.ticket", i))));

        await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 50);
        assertThat(seen).isSorted();
    }

    @Test
    void failingGroupDoesNotStopOtherGroups() {
        List<String> counter = new CopyOnWriteArrayList<>();
        registry.register("broken", "test.ticket", ObjectNode.class, (env, p) -> {
            throw new IllegalStateException("boom");
        });
        registry.register("counter", "test.ticket", ObjectNode.class, (env, p) -> counter.add(env.getEventId()));

        publisher(CafeEventingProperties.DeliveryMode.SYNC)
                .publish(List.of(event("test.ticket", 0), event("test.ticket", 1)));

        assertThat(counter).hasSize(2);
    }

    @Test
    void onlyGroupsHandlingTheTypeReceiveIt() {
        List<String> kitchen = new CopyOnWriteArrayList<>();
        List<String> billing = new CopyOnWriteArrayList<>();
        registry.register("kitchen", "test.ticket", ObjectNode.class, (env, p) -> kitchen.add(env.getEventType()));
        registry.register("billing", "test.invoice", ObjectNode.class, (env, p) -> billing.add(env.getEventType()));

        var pub = publisher(CafeEventingProperties.DeliveryMode.ASYNC);
        pub.publish(List.of(event("test.ticket", 0), event("test.invoice", 1)));

        await().atMost(Duration.ofSeconds(5)).until(() -> kitchen.size() == 1 && billing.size() == 1);
        assertThat(kitchen).containsExactly("test.ticket");
        assertThat(billing).containsExactly("test.invoice");
    }

    @Test
    void exclusiveTaskHoldsBackLiveDeliveryToItsGroup() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        registry.register("kitchen", "test.ticket", ObjectNode.class, (env, p) -> seen.add("live-" + p.get("n")));
        var pub = publisher(CafeEventingProperties.DeliveryMode.ASYNC);

        CountDownLatch taskRunning = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> task = CompletableFuture.supplyAsync(() -> pub.exclusively("kitchen", () -> {
            taskRunning.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            seen.add("task");
            return "done";
        }));
        assertThat(taskRunning.await(5, TimeUnit.SECONDS)).isTrue();

        pub.publish(List.of(event("test.ticket", 7)));
        Thread.sleep(100);
        assertThat(seen).isEmpty();

        release.countDown();
        assertThat(task.get(5, TimeUnit.SECONDS)).isEqualTo("done");
        await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 2);
        assertThat(seen).containsExactly("task", "live-7");
    }

    @Test
    void exclusiveTaskRunsInlineInSyncMode() {
        var pub = publisher(CafeEventingProperties.DeliveryMode.SYNC);

        assertThat(pub.exclusively("kitchen", () -> Thread.currentThread().getName()))
                .isEqualTo(Thread.currentThread().getName());
    }
}
