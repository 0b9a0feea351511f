package com.myorg.cafe.contracts.coffeeshop.order;

/**
 * Facts recorded for one order. Every consumer matches them through {@link Visitor},
 * so adding a variant breaks compilation until all reducers and projections handle it.
 */
public sealed interface OrderEvent permits
        OrderCreated,
        ItemAddedToOrder,
        OrderSubmitted,
        OrderDelivered,
        OrderCompleted,
        OrderItemProductNameCorrected {

    String orderId();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visit(OrderCreated event);
        R visit(ItemAddedToOrder event);
        R visit(OrderSubmitted event);
        R visit(OrderDelivered event);
        R visit(OrderCompleted event);
        R visit(OrderItemProductNameCorrected event);
    }
}
