package com.example.commerce.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Store-wide pricing rules applied when an order is placed.
 *
 * @param taxRate               fraction of the subtotal charged as tax, e.g. 0.15
 * @param freeShippingThreshold subtotals strictly above this ship free
 * @param shippingCost          flat fee charged otherwise
 */
public record PricingPolicy(BigDecimal taxRate, Money freeShippingThreshold, Money shippingCost) {

    public PricingPolicy {
        Objects.requireNonNull(taxRate, "taxRate cannot be null");
        Objects.requireNonNull(freeShippingThreshold, "freeShippingThreshold cannot be null");
        Objects.requireNonNull(shippingCost, "shippingCost cannot be null");
        if (taxRate.signum() < 0) {
            throw new IllegalArgumentException("Tax rate cannot be negative: " + taxRate);
        }
    }

    /**
     * Computes order totals for the given item subtotal. Discount is zero at creation.
     */
    public OrderTotals totalsFor(Money subtotal) {
        Money tax = subtotal.multiply(taxRate);
        Money shipping = subtotal.isGreaterThan(freeShippingThreshold)
                ? Money.zero(subtotal.getCurrency())
                : shippingCost;
        return OrderTotals.of(subtotal, tax, shipping, Money.zero(subtotal.getCurrency()));
    }
}
