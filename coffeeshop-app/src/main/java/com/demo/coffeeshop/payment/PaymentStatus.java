package com.demo.coffeeshop.payment;

public enum PaymentStatus {
    PENDING,
    PROCESSED,
    FAILED,
    REFUNDED
}
