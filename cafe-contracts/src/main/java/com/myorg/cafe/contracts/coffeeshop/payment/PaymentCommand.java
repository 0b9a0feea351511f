package com.myorg.cafe.contracts.coffeeshop.payment;

import org.javamoney.moneta.Money;

import java.util.UUID;

public sealed interface PaymentCommand {

    String paymentId();

    record CreatePayment(String id, String orderId, Money amount) implements PaymentCommand {
        public CreatePayment {
            if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        }

        @Override
        public String paymentId() {
            return id;
        }
    }

    record ProcessPayment(String paymentId) implements PaymentCommand {}

    record FailPayment(String paymentId, String reason) implements PaymentCommand {}

    record RefundPayment(String paymentId) implements PaymentCommand {}

    record ResetPayment(String paymentId) implements PaymentCommand {}
}
