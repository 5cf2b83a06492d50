package com.example.commerce.application.dto;

import com.example.commerce.domain.model.FulfillmentStatus;
import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentMethod;
import com.example.commerce.domain.model.PaymentStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Read model of an order with its lines.
 */
public record OrderView(
        String id,
        String orderNumber,
        String userId,
        String customerName,
        String customerEmail,
        String customerPhone,
        String shippingAddress,
        String shippingCity,
        String shippingCountry,
        String shippingPostal,
        BigDecimal subtotal,
        BigDecimal tax,
        BigDecimal shippingCost,
        BigDecimal discount,
        BigDecimal total,
        OrderStatus orderStatus,
        PaymentStatus paymentStatus,
        FulfillmentStatus fulfillmentStatus,
        PaymentMethod paymentMethod,
        String customerNotes,
        String internalNotes,
        String trackingNumber,
        String shippingCarrier,
        Instant paidAt,
        Instant shippedAt,
        Instant deliveredAt,
        Instant cancelledAt,
        Instant createdAt,
        List<Item> items
) {
    public record Item(
            String id,
            String productId,
            String productName,
            String productSku,
            String productImage,
            BigDecimal price,
            int quantity,
            BigDecimal subtotal
    ) {
    }
}
