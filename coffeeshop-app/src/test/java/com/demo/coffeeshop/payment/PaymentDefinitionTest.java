package com.demo.coffeeshop.payment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentCommand;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentCommand.*;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentEvent;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentEvent.PaymentFailed;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentEvent.PaymentProcessed;
import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import com.myorg.cafe.eventstore.aggregate.AggregateState;
import com.myorg.cafe.eventstore.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaymentDefinitionTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final PaymentDefinition definition = new PaymentDefinition(Clock.fixed(NOW, ZoneOffset.UTC));
    private final List<PaymentEvent> history = new ArrayList<>();
    private AggregateState<PaymentState> current = AggregateState.empty("p-1", PaymentState.initial());

    private List<PaymentEvent> send(PaymentCommand command) {
        List<PaymentEvent> events = definition.handle(current, command);
        PaymentState state = current.state();
        for (PaymentEvent e : events) {
            state = definition.reduce(state, e);
        }
        history.addAll(events);
        current = new AggregateState<>("p-1", current.sequence() + events.size(), -1, state);
        return events;
    }

    @Test
    void processCarriesOrderAndAmountAndTimestamp() {
        send(new CreatePayment("p-1", "o-1", MoneyAmounts.usd("7.58")));

        List<PaymentEvent> events = send(new ProcessPayment("p-1"));

        assertThat(events).singleElement().isInstanceOfSatisfying(PaymentProcessed.class, e -> {
            assertThat(e.orderId()).isEqualTo("o-1");
            assertThat(MoneyAmounts.hasAmount(e.amount(), "7.58")).isTrue();
            assertThat(e.processedAt()).isEqualTo(NOW);
            assertThat(e.transactionId()).isNotBlank();
        });
        assertThat(current.state().status()).isEqualTo(PaymentStatus.PROCESSED);
    }

    @Test
    void refundOnlyAfterProcessing() {
        send(new CreatePayment("p-1", "o-1", MoneyAmounts.usd("5.00")));

        assertThatThrownBy(() -> send(new RefundPayment("p-1")))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("PENDING");

        send(new ProcessPayment("p-1"));
        send(new RefundPayment("p-1"));
        assertThat(current.state().status()).isEqualTo(PaymentStatus.REFUNDED);
    }

    @Test
    void failedPaymentCannotBeProcessedUntilReset() {
        send(new CreatePayment("p-1", "o-1", MoneyAmounts.usd("5.00")));
        List<PaymentEvent> failed = send(new FailPayment("p-1", "card declined"));
        assertThat(((PaymentFailed) failed.get(0)).reason()).isEqualTo("card declined");

        assertThatThrownBy(() -> send(new ProcessPayment("p-1"))).isInstanceOf(InvalidStateTransitionException.class);

        send(new ResetPayment("p-1"));
        assertThat(current.state().status()).isEqualTo(PaymentStatus.PENDING);
        send(new ProcessPayment("p-1"));
        assertThat(current.state().status()).isEqualTo(PaymentStatus.PROCESSED);
    }

    @Test
    void amountMustBePositive() {
        assertThatThrownBy(() -> send(new CreatePayment("p-1", "o-1", MoneyAmounts.usd("0"))))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("positive");
    }

    @Test
    void replayingHistoryThroughAResetGivesTheSameState() throws Exception {
        send(new CreatePayment("p-1", "o-1", MoneyAmounts.usd("5.00")));
        send(new ProcessPayment("p-1"));
        send(new ResetPayment("p-1"));
        send(new ProcessPayment("p-1"));
        assertThat(history).hasSize(4);

        PaymentState replayed = definition.initialState();
        for (PaymentEvent e : history) {
            replayed = definition.reduce(replayed, e);
        }
        assertThat(replayed).isEqualTo(current.state());
        assertThat(replayed.status()).isEqualTo(PaymentStatus.PROCESSED);

        // snapshot taken after the reset, then the delta
        PaymentState mid = definition.initialState();
        for (PaymentEvent e : history.subList(0, 3)) {
            mid = definition.reduce(mid, e);
        }
        assertThat(mid.status()).isEqualTo(PaymentStatus.PENDING);
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules()
                .registerModule(MoneyAmounts.jacksonModule());
        mid = mapper.readValue(mapper.writeValueAsString(mid), PaymentState.class);
        mid = definition.reduce(mid, history.get(3));
        assertThat(mid).isEqualTo(replayed);
    }
}
