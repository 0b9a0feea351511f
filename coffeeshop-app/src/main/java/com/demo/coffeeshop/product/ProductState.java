package com.demo.coffeeshop.product;

import org.javamoney.moneta.Money;

public record ProductState(String id, String name, String description, Money price, String sku, boolean active) {

    public static ProductState initial() {
        return new ProductState(null, null, null, null, null, false);
    }

    ProductState updated(String name, String description, Money price) {
        return new ProductState(id, name, description, price, sku, active);
    }

    ProductState deactivated() {
        return new ProductState(id, name, description, price, sku, false);
    }
}
