package com.myorg.cafe.contracts.coffeeshop.order;

import org.javamoney.moneta.Money;

import java.util.List;

public record OrderCompleted(String orderId, String customerId, List<OrderItem> items, Money totalAmount)
        implements OrderEvent {
    public OrderCompleted {
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
