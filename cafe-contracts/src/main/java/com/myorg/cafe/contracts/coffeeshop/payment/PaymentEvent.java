package com.myorg.cafe.contracts.coffeeshop.payment;

import org.javamoney.moneta.Money;

import java.time.Instant;

/**
 * Facts recorded for one payment. Every event after creation repeats the order id and
 * amount so the payment projection never has to read its own view back.
 */
public sealed interface PaymentEvent {

    String paymentId();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visit(PaymentCreated event);
        R visit(PaymentProcessed event);
        R visit(PaymentFailed event);
        R visit(PaymentRefunded event);
        R visit(PaymentReset event);
    }

    record PaymentCreated(String id, String orderId, Money amount) implements PaymentEvent {
        @Override
        public String paymentId() {
            return id;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record PaymentProcessed(String paymentId, String orderId, Money amount, String transactionId, Instant processedAt)
            implements PaymentEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record PaymentFailed(String paymentId, String orderId, Money amount, String reason, Instant failedAt)
            implements PaymentEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record PaymentRefunded(String paymentId, String orderId, Money amount, String refundId, Instant refundedAt)
            implements PaymentEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Test-only transition back to PENDING. */
    record PaymentReset(String paymentId, String orderId, Money amount, Instant resetAt) implements PaymentEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
