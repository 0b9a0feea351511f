package com.myorg.cafe.deadletter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.cafe.contracts.core.conventions.CoreHeaders;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.AggregateIdExtractor;
import com.myorg.cafe.eventing.DefaultCafeDispatcher;
import com.myorg.cafe.eventing.HandlerRegistry;
import com.myorg.cafe.eventing.context.DispatchOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DeadLetterSequencerTest {

    private static final String GROUP = "kitchen";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HandlerRegistry registry = new HandlerRegistry(mapper);
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final Set<String> failing = new HashSet<>();
    private final List<String> delivered = new ArrayList<>();
    private final List<Object> redriveFlags = new ArrayList<>();

    private final CafeDeadLetterProperties props = new CafeDeadLetterProperties();
    private DeadLetterSequencer sequencer;
    private SequencingCafeDispatcher dispatcher;

    DeadLetterSequencerTest() {
        registry.register(GROUP, "demo.ticked", Map.class, (env, payload) -> {
            if (failing.contains(env.getAggregateId())) {
                throw new IllegalStateException("kitchen closed for " + env.getAggregateId());
            }
            if (payload.containsKey("slow")) {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
            redriveFlags.add(env.header(CoreHeaders.DEAD_LETTER_REDRIVE));
            delivered.add(env.getAggregateId() + "-" + payload.get("n"));
        });
        props.setMaxRetries(3);
        props.setBackoffBase(Duration.ofSeconds(1));
        props.setBackoffMax(Duration.ofSeconds(10));
        build();
    }

    private void build() {
        if (sequencer != null) sequencer.close();
        DefaultCafeDispatcher base = new DefaultCafeDispatcher(registry, false);
        sequencer = new DeadLetterSequencer(new InMemoryDeadLetterQueue(), props, clock, null, null);
        sequencer.attach(base);
        dispatcher = new SequencingCafeDispatcher(base, sequencer, new AggregateIdExtractor(registry));
    }

    @AfterEach
    void tearDown() {
        sequencer.close();
        DispatchOutcome.clear();
    }

    @Test
    void failedEventBlocksLaterEventsOfSameSequenceOnly() {
        failing.add("A1");

        dispatcher.dispatch(GROUP, envelope("A1", 1));
        assertThat(DispatchOutcome.consume()).isEqualTo(DispatchOutcome.DEAD_LETTERED);

        failing.clear();
        dispatcher.dispatch(GROUP, envelope("A1", 2));
        dispatcher.dispatch(GROUP, envelope("B1", 1));

        assertThat(delivered).containsExactly("B1-1");
        assertThat(sequencer.isBlocked(GROUP, "A1")).isTrue();
        assertThat(sequencer.isBlocked(GROUP, "B1")).isFalse();

        List<DeadLetter> letters = sequencer.letters(GROUP);
        assertThat(letters).hasSize(2);
        assertThat(letters.get(0).cause().getCode()).isEqualTo(IllegalStateException.class.getName());
        assertThat(letters.get(1).cause().getCode()).isEqualTo(DeadLetterSequencer.SEQUENCE_BLOCKED);
    }

    @Test
    void processAnyRedrivesHeadsInOrderAndUnblocksSequence() {
        failing.add("A1");
        dispatcher.dispatch(GROUP, envelope("A1", 1));
        dispatcher.dispatch(GROUP, envelope("A1", 2));
        failing.clear();

        assertThat(sequencer.processAny(GROUP)).isEqualTo(ProcessingResult.PROCESSED);
        assertThat(sequencer.processAny(GROUP)).isEqualTo(ProcessingResult.PROCESSED);
        assertThat(sequencer.processAny(GROUP)).isEqualTo(ProcessingResult.EMPTY);

        assertThat(delivered).containsExactly("A1-1", "A1-2");
        assertThat(redriveFlags).containsOnly(true);
        assertThat(sequencer.size(GROUP)).isZero();

        dispatcher.dispatch(GROUP, envelope("A1", 3));
        assertThat(delivered).containsExactly("A1-1", "A1-2", "A1-3");
    }

    @Test
    void failedRedrivesBackOffAndEventuallyExhaust() {
        failing.add("A1");
        dispatcher.dispatch(GROUP, envelope("A1", 1));

        assertThat(sequencer.processAny(GROUP)).isEqualTo(ProcessingResult.FAILED);
        assertThat(sequencer.processAny(GROUP)).isEqualTo(ProcessingResult.EMPTY);

        clock.advance(Duration.ofSeconds(1));
        assertThat(sequencer.processAny(GROUP)).isEqualTo(ProcessingResult.FAILED);

        clock.advance(Duration.ofSeconds(1));
        assertThat(sequencer.processAny(GROUP)).isEqualTo(ProcessingResult.EMPTY);
        clock.advance(Duration.ofSeconds(1));
        assertThat(sequencer.processAny(GROUP)).isEqualTo(ProcessingResult.FAILED);

        DeadLetter letter = sequencer.letters(GROUP).get(0);
        assertThat(letter.status()).isEqualTo(DeadLetter.Status.EXHAUSTED);
        assertThat(letter.retryCount()).isEqualTo(3);

        clock.advance(Duration.ofHours(1));
        assertThat(sequencer.processAny(GROUP)).isEqualTo(ProcessingResult.EMPTY);
        assertThat(sequencer.isBlocked(GROUP, "A1")).isTrue();

        failing.clear();
        ManualProcessingResult manual = sequencer.processManually(GROUP, 10);
        assertThat(manual).isEqualTo(new ManualProcessingResult(1, 0, 0));
        assertThat(delivered).containsExactly("A1-1");
    }

    @Test
    void manualProcessingSkipsFailedSequencesAndCountsWhatStaysBehind() {
        failing.add("A1");
        failing.add("B1");
        dispatcher.dispatch(GROUP, envelope("A1", 1));
        dispatcher.dispatch(GROUP, envelope("A1", 2));
        dispatcher.dispatch(GROUP, envelope("A1", 3));
        dispatcher.dispatch(GROUP, envelope("B1", 1));
        failing.remove("B1");

        ManualProcessingResult result = sequencer.processManually(GROUP, 10);

        assertThat(result.processed()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.ignored()).isEqualTo(2);
        assertThat(delivered).containsExactly("B1-1");
        assertThat(sequencer.size(GROUP)).isEqualTo(3);
    }

    @Test
    void manualProcessingStopsAtMaxCount() {
        failing.add("A1");
        dispatcher.dispatch(GROUP, envelope("A1", 1));
        dispatcher.dispatch(GROUP, envelope("A1", 2));
        failing.clear();

        assertThat(sequencer.processManually(GROUP, 1)).isEqualTo(new ManualProcessingResult(1, 0, 0));
        assertThat(sequencer.size(GROUP)).isEqualTo(1);
    }

    @Test
    void evictingHeadLetsNextLetterBecomeHead() {
        failing.add("A1");
        dispatcher.dispatch(GROUP, envelope("A1", 1));
        dispatcher.dispatch(GROUP, envelope("A1", 2));
        failing.clear();

        long headId = sequencer.letters(GROUP).get(0).id();
        assertThat(sequencer.evict(headId)).isTrue();
        assertThat(sequencer.evict(headId)).isFalse();

        assertThat(sequencer.processAny(GROUP)).isEqualTo(ProcessingResult.PROCESSED);
        assertThat(delivered).containsExactly("A1-2");
    }

    @Test
    void slowHandlerIsDeadLetteredWithTimeoutCause() {
        props.setHandlerTimeout(Duration.ofMillis(100));
        build();

        EventEnvelope env = envelope("S1", 1);
        ((ObjectNode) env.getPayload()).put("slow", true);

        dispatcher.dispatch(GROUP, env);

        assertThat(DispatchOutcome.consume()).isEqualTo(DispatchOutcome.DEAD_LETTERED);
        DeadLetter letter = sequencer.letters(GROUP).get(0);
        assertThat(letter.cause().getCode()).isEqualTo(HandlerTimeoutException.CODE);
        assertThat(delivered).isEmpty();
    }

    @Test
    void backoffDoublesUpToMax() {
        assertThat(sequencer.backoff(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(sequencer.backoff(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(sequencer.backoff(4)).isEqualTo(Duration.ofSeconds(8));
        assertThat(sequencer.backoff(5)).isEqualTo(Duration.ofSeconds(10));
        assertThat(sequencer.backoff(60)).isEqualTo(Duration.ofSeconds(10));
    }

    private EventEnvelope envelope(String aggregateId, int n) {
        return EventEnvelope.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType("demo.ticked")
                .aggregateId(aggregateId)
                .payload(mapper.createObjectNode().put("n", n))
                .build();
    }
}
