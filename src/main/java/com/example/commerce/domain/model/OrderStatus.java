package com.example.commerce.domain.model;

/**
 * Lifecycle stage of order fulfillment.
 */
public enum OrderStatus {
    PENDING,
    CONFIRMED,
    PROCESSING,
    SHIPPED,
    DELIVERED,
    CANCELLED,
    REFUNDED;

    /**
     * Whether an order in this status may still be cancelled by its owner.
     */
    public boolean isCancellable() {
        return this == PENDING || this == CONFIRMED;
    }
}
