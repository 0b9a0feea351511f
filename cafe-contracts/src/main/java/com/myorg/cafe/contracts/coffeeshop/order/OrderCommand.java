package com.myorg.cafe.contracts.coffeeshop.order;

import org.javamoney.moneta.Money;

import java.util.UUID;

public sealed interface OrderCommand {

    String orderId();

    record CreateOrder(String id, String customerId) implements OrderCommand {
        public CreateOrder {
            if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        }

        public CreateOrder(String customerId) {
            this(null, customerId);
        }

        @Override
        public String orderId() {
            return id;
        }
    }

    record AddItemToOrder(String orderId, String productId, String productName, int quantity, Money price)
            implements OrderCommand {}

    record SubmitOrder(String orderId) implements OrderCommand {}

    record DeliverOrder(String orderId) implements OrderCommand {}

    record CompleteOrder(String orderId) implements OrderCommand {}

    record CorrectOrderItemProductName(String orderId, String productId, String correctedProductName)
            implements OrderCommand {}
}
