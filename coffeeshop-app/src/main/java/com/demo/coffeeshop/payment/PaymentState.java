package com.demo.coffeeshop.payment;

import org.javamoney.moneta.Money;

public record PaymentState(String id, String orderId, Money amount, PaymentStatus status) {

    public static PaymentState initial() {
        return new PaymentState(null, null, null, null);
    }

    PaymentState withStatus(PaymentStatus next) {
        return new PaymentState(id, orderId, amount, next);
    }
}
