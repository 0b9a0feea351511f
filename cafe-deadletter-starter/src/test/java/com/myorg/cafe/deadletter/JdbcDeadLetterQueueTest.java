package com.myorg.cafe.deadletter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.cafe.contracts.core.envelope.ErrorInfo;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.JacksonEnvelopeCodec;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDeadLetterQueueTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private JdbcDeadLetterQueue queue;

    @BeforeEach
    void setUp() {
        JdbcDataSource h2 = new JdbcDataSource();
        h2.setURL("jdbc:h2:mem:dlq_" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1");
        h2.setUser("sa");
        h2.setPassword("sa");

        Flyway.configure()
                .dataSource(h2)
                .locations("classpath:db/migration")
                .load()
                .migrate();

        queue = new JdbcDeadLetterQueue(new JdbcTemplate(h2), new JacksonEnvelopeCodec(mapper), "cafe_dead_letter");
    }

    @Test
    void enqueuedLetterKeepsEnvelopeCauseAndDiagnostics() {
        EventEnvelope env = envelope("O-1");
        DeadLetter stored = queue.enqueue("order-view", "O-1", env, ErrorInfo.of("BOOM", "kitchen on fire"), T0,
                Map.of("thread", "main"));

        DeadLetter loaded = queue.letters("order-view").get(0);
        assertEquals(stored.id(), loaded.id());
        assertEquals(env.getEventId(), loaded.envelope().getEventId());
        assertEquals("O-1", loaded.envelope().getPayload().get("orderId").asText());
        assertEquals("BOOM", loaded.cause().getCode());
        assertEquals("kitchen on fire", loaded.cause().getMessage());
        assertEquals(DeadLetter.Status.QUEUED, loaded.status());
        assertEquals(T0, loaded.nextAttemptAt());
        assertEquals("main", loaded.diagnostics().get("thread"));
        assertTrue(loaded.isDue(T0));
    }

    @Test
    void headsReturnOldestLetterPerSequenceInEnqueueOrder() {
        DeadLetter a1 = queue.enqueue("order-view", "A", envelope("A"), ErrorInfo.of("X", "x"), T0, Map.of());
        queue.enqueue("order-view", "A", envelope("A"), ErrorInfo.of("X", "x"), T0, Map.of());
        DeadLetter b1 = queue.enqueue("order-view", "B", envelope("B"), ErrorInfo.of("X", "x"), T0, Map.of());
        queue.enqueue("payment-view", "A", envelope("A"), ErrorInfo.of("X", "x"), T0, Map.of());

        List<DeadLetter> heads = queue.heads("order-view");
        assertEquals(List.of(a1.id(), b1.id()), heads.stream().map(DeadLetter::id).toList());
        assertEquals(3, queue.size("order-view"));
        assertTrue(queue.contains("order-view", "A"));
        assertFalse(queue.contains("order-view", "C"));

        assertTrue(queue.evict(a1.id()));
        assertFalse(queue.evict(a1.id()));
        assertEquals(2, queue.heads("order-view").size());
        assertTrue(queue.contains("order-view", "A"));
    }

    @Test
    void markRetryUpdatesStatusAndSchedule() {
        DeadLetter letter = queue.enqueue("order-view", "A", envelope("A"), ErrorInfo.of("X", "x"), T0, Map.of());
        Instant later = T0.plusSeconds(30);

        queue.markRetry(letter.id(), 10, DeadLetter.Status.EXHAUSTED, later, ErrorInfo.of("Y", "still broken"), T0);

        DeadLetter updated = queue.letters("order-view").get(0);
        assertEquals(10, updated.retryCount());
        assertEquals(DeadLetter.Status.EXHAUSTED, updated.status());
        assertEquals("Y", updated.cause().getCode());
        assertEquals(later, updated.nextAttemptAt());
        assertFalse(updated.isDue(later.plusSeconds(60)));
        assertEquals(0, queue.countQueued());
    }

    private EventEnvelope envelope(String orderId) {
        return EventEnvelope.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType("coffeeshop.order.created")
                .aggregateType("order")
                .aggregateId(orderId)
                .payload(mapper.createObjectNode().put("orderId", orderId))
                .build();
    }
}
