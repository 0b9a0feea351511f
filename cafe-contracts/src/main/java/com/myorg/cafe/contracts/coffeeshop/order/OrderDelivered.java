package com.myorg.cafe.contracts.coffeeshop.order;

import org.javamoney.moneta.Money;

import java.util.List;

// carries the full order contents so projections never look anything up
public record OrderDelivered(String orderId, String customerId, List<OrderItem> items, Money totalAmount)
        implements OrderEvent {
    public OrderDelivered {
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
