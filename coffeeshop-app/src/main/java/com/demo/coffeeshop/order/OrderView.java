package com.demo.coffeeshop.order;

import com.myorg.cafe.contracts.coffeeshop.order.OrderItem;
import org.javamoney.moneta.Money;

import java.time.Instant;
import java.util.List;

public record OrderView(
        String id,
        String customerId,
        List<OrderItem> items,
        String status,
        Money totalAmount,
        Instant createdAt,
        Instant updatedAt
) {
    public OrderView {
        items = items == null ? List.of() : List.copyOf(items);
    }

    OrderView withItems(List<OrderItem> next, Instant at) {
        return new OrderView(id, customerId, next, status, totalAmount, createdAt, at);
    }

    OrderView withStatus(OrderStatus next, List<OrderItem> nextItems, Money total, Instant at) {
        return new OrderView(id, customerId, nextItems, next.name(), total, createdAt, at);
    }
}
