package com.demo.coffeeshop.order;

import com.myorg.cafe.contracts.coffeeshop.order.*;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.HandlerRegistry;
import com.myorg.cafe.eventing.ProjectionRegistration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.ORDER_CREATED;
import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.ORDER_GROUP;

/**
 * Maintains {@code order_view}. Every handler works from the event alone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderProjection implements ProjectionRegistration {

    // demo trigger for dead-lettering
    static final String ERROR_CUSTOMER = "error-customer";

    private final OrderViewRepository repository;

    @Override
    public void register(HandlerRegistry registry) {
        for (String type : OrderDefinition.EVENT_TYPES.types()) {
            bind(registry, type, OrderDefinition.EVENT_TYPES.classOf(type));
            String idField = ORDER_CREATED.equals(type) ? "id" : "orderId";
            registry.registerIdExtractor(type, payload -> payload.path(idField).asText(null));
        }
        registry.registerReset(ORDER_GROUP, () -> log.info("Reset order projection, removed {} rows", repository.deleteAll()));
    }

    private <E extends OrderEvent> void bind(HandlerRegistry registry, String type, Class<E> eventClass) {
        registry.register(ORDER_GROUP, type, eventClass, (env, event) -> event.accept(new Applier(env)));
    }

    private final class Applier implements OrderEvent.Visitor<Void> {
        private final Instant at;

        Applier(EventEnvelope env) {
            this.at = env.getOccurredAtMs() > 0 ? Instant.ofEpochMilli(env.getOccurredAtMs()) : Instant.now();
        }

        @Override
        public Void visit(OrderCreated e) {
            log.info("Processing OrderCreated for order {}", e.id());
            failFor(e.customerId(), e.id(), "OrderCreated");
            repository.save(new OrderView(e.id(), e.customerId(), List.of(), OrderStatus.NEW.name(), null, at, at));
            return null;
        }

        @Override
        public Void visit(ItemAddedToOrder e) {
            existing(e.orderId(), "ItemAddedToOrder").ifPresent(order -> {
                failFor(order.customerId(), e.orderId(), "ItemAddedToOrder");
                List<OrderItem> items = new ArrayList<>(order.items());
                items.add(new OrderItem(e.productId(), e.productName(), e.quantity(), e.price()));
                repository.save(order.withItems(items, at));
            });
            return null;
        }

        @Override
        public Void visit(OrderSubmitted e) {
            existing(e.orderId(), "OrderSubmitted").ifPresent(order -> {
                failFor(order.customerId(), e.orderId(), "OrderSubmitted");
                repository.save(order.withStatus(OrderStatus.SUBMITTED, e.items(), e.totalAmount(), at));
            });
            return null;
        }

        @Override
        public Void visit(OrderDelivered e) {
            existing(e.orderId(), "OrderDelivered").ifPresent(order ->
                    repository.save(order.withStatus(OrderStatus.DELIVERED, e.items(), e.totalAmount(), at)));
            return null;
        }

        @Override
        public Void visit(OrderCompleted e) {
            existing(e.orderId(), "OrderCompleted").ifPresent(order ->
                    repository.save(order.withStatus(OrderStatus.COMPLETED, e.items(), e.totalAmount(), at)));
            return null;
        }

        @Override
        public Void visit(OrderItemProductNameCorrected e) {
            existing(e.orderId(), "OrderItemProductNameCorrected").ifPresent(order -> {
                log.info("Correcting product name on order {} product {} '{}' -> '{}'",
                        e.orderId(), e.productId(), e.oldProductName(), e.correctedProductName());
                List<OrderItem> items = order.items().stream()
                        .map(i -> i.productId().equals(e.productId()) ? i.withProductName(e.correctedProductName()) : i)
                        .toList();
                repository.save(order.withItems(items, at));
            });
            return null;
        }
    }

    private Optional<OrderView> existing(String orderId, String eventName) {
        Optional<OrderView> order = repository.findById(orderId);
        if (order.isEmpty()) {
            log.warn("No order_view row for order {} while applying {}, skipping", orderId, eventName);
        }
        return order;
    }

    private static void failFor(String customerId, String orderId, String eventName) {
        if (ERROR_CUSTOMER.equals(customerId)) {
            throw new IllegalStateException("Simulated error processing " + eventName + " for order " + orderId
                    + " with customer ID " + ERROR_CUSTOMER);
        }
    }
}
