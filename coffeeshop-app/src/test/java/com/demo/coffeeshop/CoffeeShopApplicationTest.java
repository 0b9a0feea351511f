package com.demo.coffeeshop;

import com.demo.coffeeshop.order.OrderService;
import com.demo.coffeeshop.order.OrderStatus;
import com.demo.coffeeshop.order.OrderView;
import com.demo.coffeeshop.order.OrderViewRepository;
import com.demo.coffeeshop.payment.PaymentService;
import com.demo.coffeeshop.payment.PaymentStatus;
import com.demo.coffeeshop.payment.PaymentViewRepository;
import com.demo.coffeeshop.product.ProductService;
import com.demo.coffeeshop.product.ProductViewRepository;
import com.myorg.cafe.contracts.coffeeshop.order.OrderCommand.*;
import com.myorg.cafe.contracts.coffeeshop.order.OrderCreated;
import com.myorg.cafe.contracts.coffeeshop.order.OrderItem;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentCommand.*;
import com.myorg.cafe.contracts.coffeeshop.product.ProductCommand.*;
import com.myorg.cafe.deadletter.DeadLetter;
import com.myorg.cafe.deadletter.DeadLetterProcessor;
import com.myorg.cafe.deadletter.DeadLetterSequencer;
import com.myorg.cafe.deadletter.ManualProcessingResult;
import com.myorg.cafe.eventing.ProjectionRegistration;
import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import com.myorg.cafe.eventstore.replay.ProjectionReplayer;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.*;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class CoffeeShopApplicationTest {

    static final String AUDIT_GROUP = "audit";

    @Autowired OrderService orders;
    @Autowired PaymentService payments;
    @Autowired ProductService products;
    @Autowired OrderViewRepository orderViews;
    @Autowired PaymentViewRepository paymentViews;
    @Autowired ProductViewRepository productViews;
    @Autowired DeadLetterSequencer sequencer;
    @Autowired DeadLetterProcessor processor;
    @Autowired ProjectionReplayer replayer;
    @Autowired MeterRegistry meters;

    @AfterEach
    void healAudit() {
        AuditConfig.FAILING.set(false);
    }

    private static String id(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    private List<DeadLetter> lettersFor(String group, String key) {
        return sequencer.letters(group).stream().filter(l -> l.sequenceKey().equals(key)).toList();
    }

    @Test
    void orderFlowEndsCompletedInReadModel() {
        String orderId = id("order");
        orders.execute(new CreateOrder(orderId, "alice"));
        orders.execute(new AddItemToOrder(orderId, "latte-001", "Latte", 2, MoneyAmounts.usd("2.50")));
        orders.execute(new AddItemToOrder(orderId, "croissant-001", "Croissant", 1, MoneyAmounts.usd("2.00")));
        orders.execute(new SubmitOrder(orderId));
        orders.execute(new DeliverOrder(orderId));
        var result = orders.execute(new CompleteOrder(orderId));

        assertThat(result.sequence()).isEqualTo(5);

        OrderView view = orderViews.findById(orderId).orElseThrow();
        assertThat(view.status()).isEqualTo(OrderStatus.COMPLETED.name());
        assertThat(MoneyAmounts.hasAmount(view.totalAmount(), "7.58")).isTrue();
        assertThat(view.items()).extracting(OrderItem::productId).containsExactly("latte-001", "croissant-001");
        assertThat(orders.load(orderId).state().items()).isEqualTo(view.items());
        assertThat(lettersFor(ORDER_GROUP, orderId)).isEmpty();
    }

    @Test
    void failingOrderBlocksOnlyItsOwnSequence() {
        String bad = id("order");
        String good = id("order");

        orders.execute(new CreateOrder(bad, "error-customer"));
        orders.execute(new CreateOrder(good, "bob"));
        orders.execute(new AddItemToOrder(bad, "latte-001", "Latte", 1, MoneyAmounts.usd("3.00")));
        orders.execute(new AddItemToOrder(good, "latte-001", "Latte", 1, MoneyAmounts.usd("3.00")));

        List<DeadLetter> parked = lettersFor(ORDER_GROUP, bad);
        assertThat(parked).hasSize(2);
        assertThat(parked.get(0).cause().getMessage()).contains("error-customer");
        assertThat(parked.get(1).cause().getCode()).isEqualTo(DeadLetterSequencer.SEQUENCE_BLOCKED);
        assertThat(parked.get(1).envelope().getEventType()).isEqualTo(ORDER_ITEM_ADDED);

        // the write side never sees projection failures
        assertThat(orders.load(bad).state().items()).hasSize(1);
        assertThat(orderViews.findById(bad)).isEmpty();
        assertThat(orderViews.findById(good).orElseThrow().items()).hasSize(1);
        assertThat(lettersFor(ORDER_GROUP, good)).isEmpty();
    }

    @Test
    void poisonedPaymentResetIsParkedWhileAggregateMovesOn() {
        String paymentId = id("pay");
        payments.execute(new CreatePayment(paymentId, "order-2", MoneyAmounts.usd("13.13")));
        payments.execute(new ProcessPayment(paymentId));
        payments.execute(new ResetPayment(paymentId));

        assertThat(payments.load(paymentId).state().status()).isEqualTo(PaymentStatus.PENDING);
        assertThat(paymentViews.findById(paymentId).orElseThrow().status()).isEqualTo(PaymentStatus.PROCESSED.name());
        assertThat(lettersFor(PAYMENT_GROUP, paymentId)).singleElement()
                .satisfies(l -> assertThat(l.envelope().getEventType()).isEqualTo(PAYMENT_RESET));

        // later events of the same payment queue up behind the parked reset
        payments.execute(new ProcessPayment(paymentId));
        assertThat(lettersFor(PAYMENT_GROUP, paymentId))
                .extracting(l -> l.envelope().getEventType())
                .containsExactly(PAYMENT_RESET, PAYMENT_PROCESSED);

        ManualProcessingResult manual = sequencer.processManually(PAYMENT_GROUP, 10);
        assertThat(manual.processed()).isZero();
        assertThat(manual.failed()).isEqualTo(1);
        assertThat(manual.ignored()).isEqualTo(1);
        assertThat(lettersFor(PAYMENT_GROUP, paymentId).get(0).retryCount()).isEqualTo(1);
    }

    @Test
    void poisonedProductPriceIsParked() {
        String productId = id("prod");
        products.execute(new CreateProduct(productId, "Cold brew", null, MoneyAmounts.usd("99.99"), null));

        assertThat(productViews.findById(productId)).isEmpty();
        assertThat(lettersFor(PRODUCT_GROUP, productId)).singleElement()
                .satisfies(l -> assertThat(l.cause().getMessage()).contains("99.99"));
        assertThat(products.load(productId).state().sku()).isEqualTo("COL-LEGACY");
    }

    @Test
    void productDeleteKeepsInactiveRow() {
        String productId = id("prod");
        products.execute(new CreateProduct(productId, "Flat white", "Milky", MoneyAmounts.usd("4.20"), "COF-FLW-001"));
        products.execute(new UpdateProduct(productId, "Flat white", "Milkier", MoneyAmounts.usd("4.40")));
        products.execute(new DeleteProduct(productId));

        var row = productViews.findById(productId).orElseThrow();
        assertThat(row.active()).isFalse();
        assertThat(row.description()).isEqualTo("Milkier");
        assertThat(productViews.findAll(false)).noneMatch(p -> p.id().equals(productId));
        assertThat(productViews.findAll(true)).anyMatch(p -> p.id().equals(productId));
    }

    @Test
    void parkedLetterIsRedrivenOnceTheHandlerRecovers() {
        AuditConfig.FAILING.set(true);
        String orderId = id("order");
        orders.execute(new CreateOrder(orderId, "carol"));

        assertThat(orderViews.findById(orderId)).isPresent();
        assertThat(lettersFor(AUDIT_GROUP, orderId)).hasSize(1);
        assertThat(AuditConfig.SEEN).doesNotContain(orderId);

        AuditConfig.FAILING.set(false);
        processor.runOnce();

        assertThat(lettersFor(AUDIT_GROUP, orderId)).isEmpty();
        assertThat(AuditConfig.SEEN).contains(orderId);
        assertThat(meters.find("cafe.deadletter.redrive.success").counter()).isNotNull();
        assertThat(meters.find("cafe.deadletter.redrive.success").counter().count()).isGreaterThanOrEqualTo(1.0);
    }

    @Test
    void replayRebuildsTheOrderReadModel() {
        String orderId = id("order");
        orders.execute(new CreateOrder(orderId, "dave"));
        orders.execute(new AddItemToOrder(orderId, "mocha-001", "Mocha", 1, MoneyAmounts.usd("4.00")));
        orders.execute(new SubmitOrder(orderId));
        OrderView before = orderViews.findById(orderId).orElseThrow();

        ProjectionReplayer.ReplayResult result = replayer.replay(ORDER_GROUP);

        assertThat(result.dispatched()).isGreaterThanOrEqualTo(3);
        OrderView after = orderViews.findById(orderId).orElseThrow();
        assertThat(after.status()).isEqualTo(before.status());
        assertThat(after.items()).isEqualTo(before.items());
        assertThat(after.totalAmount().isEqualTo(before.totalAmount())).isTrue();
    }

    @TestConfiguration
    static class AuditConfig {
        static final AtomicBoolean FAILING = new AtomicBoolean();
        static final Set<String> SEEN = new CopyOnWriteArraySet<>();

        @Bean
        ProjectionRegistration auditProjection() {
            return registry -> registry.register(AUDIT_GROUP, ORDER_CREATED, OrderCreated.class, (env, event) -> {
                if (FAILING.get()) throw new IllegalStateException("audit sink down for " + event.id());
                SEEN.add(event.id());
            });
        }
    }
}
