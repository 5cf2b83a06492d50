package com.example.commerce.infrastructure.adapter.in.web.dto;

import com.example.commerce.domain.model.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record PaymentRequest(
        @NotBlank(message = "Order id is required")
        String orderId,

        @NotNull(message = "Payment method is required")
        PaymentMethod method,

        @NotNull(message = "Amount is required")
        @DecimalMin(value = "0.01", message = "Amount must be positive")
        BigDecimal amount,

        String returnUrl,
        String cancelUrl
) {
}
