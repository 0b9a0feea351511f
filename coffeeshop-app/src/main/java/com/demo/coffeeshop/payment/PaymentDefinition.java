package com.demo.coffeeshop.payment;

import com.myorg.cafe.contracts.coffeeshop.payment.PaymentCommand;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentCommand.*;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentEvent;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentEvent.*;
import com.myorg.cafe.eventstore.aggregate.AggregateDefinition;
import com.myorg.cafe.eventstore.aggregate.AggregateState;
import com.myorg.cafe.eventstore.aggregate.EventTypeTable;
import com.myorg.cafe.eventstore.exception.InvalidStateTransitionException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.*;

/**
 * Payment lifecycle: PENDING, then PROCESSED or FAILED; a processed payment may be refunded.
 * Timestamps and generated ids are decided here so that {@link #reduce} stays a pure fold.
 */
@Component
@RequiredArgsConstructor
public class PaymentDefinition implements AggregateDefinition<PaymentState, PaymentCommand, PaymentEvent> {

    public static final EventTypeTable<PaymentEvent> EVENT_TYPES = EventTypeTable.<PaymentEvent>builder()
            .register(PAYMENT_CREATED, PaymentCreated.class)
            .register(PAYMENT_PROCESSED, PaymentProcessed.class)
            .register(PAYMENT_FAILED, PaymentFailed.class)
            .register(PAYMENT_REFUNDED, PaymentRefunded.class)
            .register(PAYMENT_RESET, PaymentReset.class)
            .build();

    private final Clock clock;

    @Override
    public String aggregateType() {
        return PAYMENT_AGGREGATE;
    }

    @Override
    public PaymentState initialState() {
        return PaymentState.initial();
    }

    @Override
    public Class<PaymentState> stateClass() {
        return PaymentState.class;
    }

    @Override
    public EventTypeTable<PaymentEvent> eventTypes() {
        return EVENT_TYPES;
    }

    @Override
    public PaymentState reduce(PaymentState state, PaymentEvent event) {
        return event.accept(new PaymentEvent.Visitor<>() {
            @Override
            public PaymentState visit(PaymentCreated e) {
                return new PaymentState(e.id(), e.orderId(), e.amount(), PaymentStatus.PENDING);
            }

            @Override
            public PaymentState visit(PaymentProcessed e) {
                return state.withStatus(PaymentStatus.PROCESSED);
            }

            @Override
            public PaymentState visit(PaymentFailed e) {
                return state.withStatus(PaymentStatus.FAILED);
            }

            @Override
            public PaymentState visit(PaymentRefunded e) {
                return state.withStatus(PaymentStatus.REFUNDED);
            }

            @Override
            public PaymentState visit(PaymentReset e) {
                return state.withStatus(PaymentStatus.PENDING);
            }
        });
    }

    @Override
    public List<PaymentEvent> handle(AggregateState<PaymentState> current, PaymentCommand command) {
        PaymentState s = current.state();
        Instant now = clock.instant();

        if (command instanceof CreatePayment c) {
            if (c.orderId() == null || c.orderId().isBlank()) throw reject(command, s, "orderId is required");
            if (c.amount() == null || !c.amount().isPositive()) {
                throw reject(command, s, "amount must be positive");
            }
            return List.of(new PaymentCreated(c.id(), c.orderId(), c.amount()));
        }
        if (command instanceof ProcessPayment) {
            requireStatus(command, s, PaymentStatus.PENDING, "Only PENDING payments can be processed");
            return List.of(new PaymentProcessed(s.id(), s.orderId(), s.amount(), UUID.randomUUID().toString(), now));
        }
        if (command instanceof FailPayment c) {
            requireStatus(command, s, PaymentStatus.PENDING, "Only PENDING payments can fail");
            String reason = c.reason() == null || c.reason().isBlank() ? "unspecified" : c.reason();
            return List.of(new PaymentFailed(s.id(), s.orderId(), s.amount(), reason, now));
        }
        if (command instanceof RefundPayment) {
            requireStatus(command, s, PaymentStatus.PROCESSED, "Only PROCESSED payments can be refunded");
            return List.of(new PaymentRefunded(s.id(), s.orderId(), s.amount(), UUID.randomUUID().toString(), now));
        }
        if (command instanceof ResetPayment) {
            return List.of(new PaymentReset(s.id(), s.orderId(), s.amount(), now));
        }
        throw new IllegalArgumentException("Unsupported payment command " + command.getClass().getName());
    }

    @Override
    public String targetId(PaymentCommand command) {
        return command.paymentId();
    }

    @Override
    public boolean isCreation(PaymentCommand command) {
        return command instanceof CreatePayment;
    }

    private static void requireStatus(PaymentCommand command, PaymentState s, PaymentStatus expected, String message) {
        if (s.status() != expected) throw reject(command, s, message);
    }

    private static InvalidStateTransitionException reject(PaymentCommand command, PaymentState s, String message) {
        String state = s.status() == null ? "NONE" : s.status().name();
        return new InvalidStateTransitionException(command.getClass().getSimpleName(), state, message);
    }
}
