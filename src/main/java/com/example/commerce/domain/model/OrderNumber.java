package com.example.commerce.domain.model;

/**
 * Human-facing sequential order number, e.g. {@code ORD-000042}.
 */
public final class OrderNumber {

    private static final String PREFIX = "ORD-";

    private OrderNumber() {
    }

    /**
     * Formats the number that follows {@code existingOrders} placed orders.
     */
    public static String next(long existingOrders) {
        return PREFIX + String.format("%06d", existingOrders + 1);
    }
}
