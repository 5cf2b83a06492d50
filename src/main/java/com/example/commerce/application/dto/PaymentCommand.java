package com.example.commerce.application.dto;

import com.example.commerce.domain.model.PaymentMethod;

import java.math.BigDecimal;

/**
 * Request to pay for an order. Return and cancel URLs are only used by redirect gateways.
 */
public record PaymentCommand(
        String orderId,
        PaymentMethod method,
        BigDecimal amount,
        String returnUrl,
        String cancelUrl
) {
}
