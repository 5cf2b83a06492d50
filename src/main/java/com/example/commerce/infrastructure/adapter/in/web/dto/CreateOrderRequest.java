package com.example.commerce.infrastructure.adapter.in.web.dto;

import com.example.commerce.domain.model.PaymentMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for placing an order via REST API.
 */
public record CreateOrderRequest(
        @NotEmpty(message = "Order must have at least one item")
        @Valid
        List<OrderItemRequest> items,

        @NotBlank(message = "Shipping address is required")
        @Size(min = 5, message = "Shipping address must be at least 5 characters")
        String shippingAddress,

        @NotBlank(message = "Shipping city is required")
        @Size(min = 2, message = "Shipping city must be at least 2 characters")
        String shippingCity,

        @NotBlank(message = "Shipping country is required")
        @Size(min = 2, message = "Shipping country must be at least 2 characters")
        String shippingCountry,

        String shippingPostal,

        @NotNull(message = "Payment method is required")
        PaymentMethod paymentMethod,

        @Size(max = 1000, message = "Notes cannot exceed 1000 characters")
        String customerNotes
) {
    public record OrderItemRequest(
            @NotBlank(message = "Product id is required")
            String productId,

            @NotNull(message = "Quantity is required")
            @Positive(message = "Quantity must be positive")
            Integer quantity
    ) {}
}
