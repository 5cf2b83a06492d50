package com.example.commerce.application.dto;

import com.example.commerce.domain.model.PaymentMethod;

import java.util.List;

/**
 * Command for placing an order on behalf of a user.
 */
public record CreateOrderCommand(
        String userId,
        List<Line> items,
        String shippingAddress,
        String shippingCity,
        String shippingCountry,
        String shippingPostal,
        PaymentMethod paymentMethod,
        String customerNotes
) {
    public CreateOrderCommand {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Order must have at least one item");
        }
        items = List.copyOf(items);
    }

    public record Line(String productId, int quantity) {
        public Line {
            if (quantity <= 0) {
                throw new IllegalArgumentException("Quantity must be positive: " + quantity);
            }
        }
    }
}
