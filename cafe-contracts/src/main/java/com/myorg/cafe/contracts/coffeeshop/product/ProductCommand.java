package com.myorg.cafe.contracts.coffeeshop.product;

import org.javamoney.moneta.Money;

import java.util.UUID;

public sealed interface ProductCommand {

    String id();

    record CreateProduct(String id, String name, String description, Money price, String sku) implements ProductCommand {
        public CreateProduct {
            if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        }
    }

    record UpdateProduct(String id, String name, String description, Money price) implements ProductCommand {}

    record DeleteProduct(String id) implements ProductCommand {}
}
