package com.myorg.cafe.contracts.coffeeshop.order;

import org.javamoney.moneta.Money;

import java.util.List;

public record OrderSubmitted(String orderId, List<OrderItem> items, Money totalAmount) implements OrderEvent {
    public OrderSubmitted {
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
