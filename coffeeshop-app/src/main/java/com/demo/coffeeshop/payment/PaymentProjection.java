package com.demo.coffeeshop.payment;

import com.myorg.cafe.contracts.coffeeshop.payment.PaymentEvent;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentEvent.*;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.HandlerRegistry;
import com.myorg.cafe.eventing.ProjectionRegistration;
import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.PAYMENT_CREATED;
import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.PAYMENT_GROUP;

/**
 * Maintains {@code payment_view}. Each event repeats order id and amount, so every handler
 * writes the full row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentProjection implements ProjectionRegistration {

    // demo trigger for dead-lettering
    static final String POISON_RESET_AMOUNT = "13.13";

    private final PaymentViewRepository repository;

    @Override
    public void register(HandlerRegistry registry) {
        for (String type : PaymentDefinition.EVENT_TYPES.types()) {
            bind(registry, type, PaymentDefinition.EVENT_TYPES.classOf(type));
            String idField = PAYMENT_CREATED.equals(type) ? "id" : "paymentId";
            registry.registerIdExtractor(type, payload -> payload.path(idField).asText(null));
        }
        registry.registerReset(PAYMENT_GROUP, () -> log.info("Reset payment projection, removed {} rows", repository.deleteAll()));
    }

    private <E extends PaymentEvent> void bind(HandlerRegistry registry, String type, Class<E> eventClass) {
        registry.register(PAYMENT_GROUP, type, eventClass, (env, event) -> event.accept(new Applier(env)));
    }

    private final class Applier implements PaymentEvent.Visitor<Void> {
        private final Instant at;

        Applier(EventEnvelope env) {
            this.at = env.getOccurredAtMs() > 0 ? Instant.ofEpochMilli(env.getOccurredAtMs()) : Instant.now();
        }

        @Override
        public Void visit(PaymentCreated e) {
            repository.save(new PaymentView(e.id(), e.orderId(), e.amount(), PaymentStatus.PENDING.name(),
                    null, null, null, at));
            return null;
        }

        @Override
        public Void visit(PaymentProcessed e) {
            log.info("Payment {} processed, transaction {}", e.paymentId(), e.transactionId());
            repository.save(new PaymentView(e.paymentId(), e.orderId(), e.amount(), PaymentStatus.PROCESSED.name(),
                    e.transactionId(), null, null, at));
            return null;
        }

        @Override
        public Void visit(PaymentFailed e) {
            repository.save(new PaymentView(e.paymentId(), e.orderId(), e.amount(), PaymentStatus.FAILED.name(),
                    null, null, e.reason(), at));
            return null;
        }

        @Override
        public Void visit(PaymentRefunded e) {
            String transactionId = repository.findById(e.paymentId()).map(PaymentView::transactionId).orElse(null);
            repository.save(new PaymentView(e.paymentId(), e.orderId(), e.amount(), PaymentStatus.REFUNDED.name(),
                    transactionId, e.refundId(), null, at));
            return null;
        }

        @Override
        public Void visit(PaymentReset e) {
            if (MoneyAmounts.hasAmount(e.amount(), POISON_RESET_AMOUNT)) {
                throw new IllegalStateException("Simulated error processing PaymentReset for payment "
                        + e.paymentId() + " with amount " + POISON_RESET_AMOUNT);
            }
            repository.save(new PaymentView(e.paymentId(), e.orderId(), e.amount(), PaymentStatus.PENDING.name(),
                    null, null, null, at));
            return null;
        }
    }
}
