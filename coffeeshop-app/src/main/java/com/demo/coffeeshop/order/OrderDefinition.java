package com.demo.coffeeshop.order;

import com.myorg.cafe.contracts.coffeeshop.order.*;
import com.myorg.cafe.contracts.coffeeshop.order.OrderCommand.*;
import com.myorg.cafe.eventstore.aggregate.AggregateDefinition;
import com.myorg.cafe.eventstore.aggregate.AggregateState;
import com.myorg.cafe.eventstore.aggregate.EventTypeTable;
import com.myorg.cafe.eventstore.exception.InvalidStateTransitionException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.money.CurrencyUnit;
import java.util.List;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.*;

@Component
@RequiredArgsConstructor
public class OrderDefinition implements AggregateDefinition<OrderState, OrderCommand, OrderEvent> {

    public static final EventTypeTable<OrderEvent> EVENT_TYPES = EventTypeTable.<OrderEvent>builder()
            .register(ORDER_CREATED, OrderCreated.class)
            .register(ORDER_ITEM_ADDED, ItemAddedToOrder.class, ITEM_ADDED_REVISION)
            .register(ORDER_SUBMITTED, OrderSubmitted.class, ORDER_SUBMITTED_REVISION)
            .register(ORDER_DELIVERED, OrderDelivered.class)
            .register(ORDER_COMPLETED, OrderCompleted.class)
            .register(ORDER_ITEM_NAME_CORRECTED, OrderItemProductNameCorrected.class)
            .build();

    private final OrderTotalCalculator totalCalculator;

    @Override
    public String aggregateType() {
        return ORDER_AGGREGATE;
    }

    @Override
    public OrderState initialState() {
        return OrderState.initial();
    }

    @Override
    public Class<OrderState> stateClass() {
        return OrderState.class;
    }

    @Override
    public EventTypeTable<OrderEvent> eventTypes() {
        return EVENT_TYPES;
    }

    @Override
    public OrderState reduce(OrderState state, OrderEvent event) {
        return event.accept(new OrderEvent.Visitor<>() {
            @Override
            public OrderState visit(OrderCreated e) {
                return new OrderState(e.id(), e.customerId(), List.of(), OrderStatus.NEW, null);
            }

            @Override
            public OrderState visit(ItemAddedToOrder e) {
                return state.withItem(new OrderItem(e.productId(), e.productName(), e.quantity(), e.price()));
            }

            @Override
            public OrderState visit(OrderSubmitted e) {
                return state.submitted(e.totalAmount());
            }

            @Override
            public OrderState visit(OrderDelivered e) {
                return state.withStatus(OrderStatus.DELIVERED);
            }

            @Override
            public OrderState visit(OrderCompleted e) {
                return state.withStatus(OrderStatus.COMPLETED);
            }

            @Override
            public OrderState visit(OrderItemProductNameCorrected e) {
                return state.withItems(state.items().stream()
                        .map(i -> i.productId().equals(e.productId()) ? i.withProductName(e.correctedProductName()) : i)
                        .toList());
            }
        });
    }

    @Override
    public List<OrderEvent> handle(AggregateState<OrderState> current, OrderCommand command) {
        OrderState s = current.state();

        if (command instanceof CreateOrder c) {
            if (isBlank(c.customerId())) throw reject(command, s, "customerId is required");
            return List.of(new OrderCreated(c.id(), c.customerId()));
        }
        if (command instanceof AddItemToOrder c) {
            requireStatus(command, s, OrderStatus.NEW, "Cannot add items to an order that is not in NEW status");
            if (isBlank(c.productId())) throw reject(command, s, "productId is required");
            if (c.quantity() <= 0) throw reject(command, s, "quantity must be positive");
            if (c.price() == null || c.price().isNegative()) throw reject(command, s, "price must not be negative");
            CurrencyUnit orderCurrency = OrderTotalCalculator.currencyOf(s.items());
            if (!s.items().isEmpty() && !c.price().getCurrency().equals(orderCurrency)) {
                throw reject(command, s, "price currency " + c.price().getCurrency().getCurrencyCode()
                        + " does not match order currency " + orderCurrency.getCurrencyCode());
            }
            return List.of(new ItemAddedToOrder(s.id(), c.productId(), c.productName(), c.quantity(), c.price()));
        }
        if (command instanceof SubmitOrder) {
            requireStatus(command, s, OrderStatus.NEW, "Cannot submit an order that is not in NEW status");
            if (s.items().isEmpty()) throw reject(command, s, "Cannot submit an empty order");
            return List.of(new OrderSubmitted(s.id(), s.items(), totalCalculator.calculateTotal(s.items())));
        }
        if (command instanceof DeliverOrder) {
            requireStatus(command, s, OrderStatus.SUBMITTED, "Cannot deliver an order that is not in SUBMITTED status");
            return List.of(new OrderDelivered(s.id(), s.customerId(), s.items(), s.totalAmount()));
        }
        if (command instanceof CompleteOrder) {
            requireStatus(command, s, OrderStatus.DELIVERED, "Cannot complete an order that is not in DELIVERED status");
            return List.of(new OrderCompleted(s.id(), s.customerId(), s.items(), s.totalAmount()));
        }
        if (command instanceof CorrectOrderItemProductName c) {
            if (isBlank(c.correctedProductName())) throw reject(command, s, "correctedProductName is required");
            OrderItem item = s.items().stream()
                    .filter(i -> i.productId().equals(c.productId()))
                    .findFirst()
                    .orElseThrow(() -> reject(command, s, "Order has no item for product " + c.productId()));
            if (c.correctedProductName().equals(item.productName())) return List.of();
            return List.of(new OrderItemProductNameCorrected(s.id(), c.productId(), item.productName(),
                    c.correctedProductName()));
        }
        throw new IllegalArgumentException("Unsupported order command " + command.getClass().getName());
    }

    @Override
    public String targetId(OrderCommand command) {
        return command.orderId();
    }

    @Override
    public boolean isCreation(OrderCommand command) {
        return command instanceof CreateOrder;
    }

    private static void requireStatus(OrderCommand command, OrderState s, OrderStatus expected, String message) {
        if (s.status() != expected) throw reject(command, s, message);
    }

    private static InvalidStateTransitionException reject(OrderCommand command, OrderState s, String message) {
        return new InvalidStateTransitionException(command.getClass().getSimpleName(), s.status().name(), message);
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }
}
