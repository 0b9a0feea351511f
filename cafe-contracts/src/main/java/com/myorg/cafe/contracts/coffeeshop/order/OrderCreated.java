package com.myorg.cafe.contracts.coffeeshop.order;

public record OrderCreated(String id, String customerId) implements OrderEvent {
    @Override
    public String orderId() {
        return id;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
