package com.example.commerce.application.dto;

import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentStatus;

import java.math.BigDecimal;
import java.time.Instant;

public record RecentOrderView(
        String id,
        String orderNumber,
        String customerName,
        BigDecimal total,
        OrderStatus orderStatus,
        PaymentStatus paymentStatus,
        Instant createdAt
) {
}
