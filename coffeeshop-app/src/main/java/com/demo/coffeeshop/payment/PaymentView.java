package com.demo.coffeeshop.payment;

import org.javamoney.moneta.Money;

import java.time.Instant;

public record PaymentView(String id,
                          String orderId,
                          Money amount,
                          String status,
                          String transactionId,
                          String refundId,
                          String failureReason,
                          Instant updatedAt) {
}
