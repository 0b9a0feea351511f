package com.myorg.cafe.contracts.coffeeshop.order;

import org.javamoney.moneta.Money;

public record ItemAddedToOrder(
        String orderId,
        String productId,
        String productName,
        int quantity,
        Money price
) implements OrderEvent {
    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
