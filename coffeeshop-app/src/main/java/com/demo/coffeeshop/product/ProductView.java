package com.demo.coffeeshop.product;

import org.javamoney.moneta.Money;

import java.time.Instant;

public record ProductView(String id, String name, String description, Money price, String sku, boolean active,
                          Instant updatedAt) {

    ProductView updated(String name, String description, Money price, Instant at) {
        return new ProductView(id, name, description, price, sku, active, at);
    }

    ProductView deactivated(Instant at) {
        return new ProductView(id, name, description, price, sku, false, at);
    }
}
