package com.myorg.cafe.contracts.coffeeshop.order;

// compensating event, history is never rewritten
public record OrderItemProductNameCorrected(
        String orderId,
        String productId,
        String oldProductName,
        String correctedProductName
) implements OrderEvent {
    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
