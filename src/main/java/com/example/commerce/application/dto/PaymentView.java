package com.example.commerce.application.dto;

import com.example.commerce.domain.model.PaymentMethod;
import com.example.commerce.domain.model.PaymentStatus;

import java.math.BigDecimal;
import java.time.Instant;

public record PaymentView(
        String id,
        String orderId,
        String orderNumber,
        BigDecimal amount,
        PaymentMethod method,
        PaymentStatus status,
        String transactionId,
        String failureReason,
        Instant processedAt,
        Instant createdAt
) {
}
