package com.example.commerce.domain.model;

/**
 * Monetary breakdown of an order, fixed once the order is placed.
 */
public record OrderTotals(Money subtotal, Money tax, Money shippingCost, Money discount, Money total) {

    /**
     * Derives the total as {@code subtotal + tax + shippingCost - discount}.
     */
    public static OrderTotals of(Money subtotal, Money tax, Money shippingCost, Money discount) {
        Money total = subtotal.add(tax).add(shippingCost).subtract(discount);
        return new OrderTotals(subtotal, tax, shippingCost, discount, total);
    }
}
