package com.example.commerce.domain.model;

/**
 * Lifecycle stage of the monetary transaction behind an order or a payment attempt.
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED,
    PARTIALLY_REFUNDED
}
