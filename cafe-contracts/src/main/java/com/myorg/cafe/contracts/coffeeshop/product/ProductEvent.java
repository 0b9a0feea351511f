package com.myorg.cafe.contracts.coffeeshop.product;

import org.javamoney.moneta.Money;

public sealed interface ProductEvent {

    String id();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visit(ProductCreated event);
        R visit(ProductUpdated event);
        R visit(ProductDeleted event);
    }

    record ProductCreated(String id, String name, String description, Money price, String sku) implements ProductEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ProductUpdated(String id, String name, String description, Money price) implements ProductEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ProductDeleted(String id) implements ProductEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
