package com.demo.coffeeshop.order;

import com.myorg.cafe.contracts.coffeeshop.order.OrderItem;
import org.javamoney.moneta.Money;

import java.util.ArrayList;
import java.util.List;

public record OrderState(String id, String customerId, List<OrderItem> items, OrderStatus status, Money totalAmount) {

    public OrderState {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static OrderState initial() {
        return new OrderState(null, null, List.of(), OrderStatus.NEW, null);
    }

    OrderState withItem(OrderItem item) {
        List<OrderItem> next = new ArrayList<>(items);
        next.add(item);
        return new OrderState(id, customerId, next, status, totalAmount);
    }

    OrderState withItems(List<OrderItem> next) {
        return new OrderState(id, customerId, next, status, totalAmount);
    }

    OrderState withStatus(OrderStatus next) {
        return new OrderState(id, customerId, items, next, totalAmount);
    }

    OrderState submitted(Money total) {
        return new OrderState(id, customerId, items, OrderStatus.SUBMITTED, total);
    }
}
