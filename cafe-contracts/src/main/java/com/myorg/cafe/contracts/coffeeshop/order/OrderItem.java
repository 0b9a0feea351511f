package com.myorg.cafe.contracts.coffeeshop.order;

import org.javamoney.moneta.Money;

public record OrderItem(
        String productId,
        String productName,
        int quantity,
        Money price
) {
    public OrderItem withProductName(String name) {
        return new OrderItem(productId, name, quantity, price);
    }
}
