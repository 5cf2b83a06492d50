package com.example.commerce.application.dto;

import com.example.commerce.domain.model.FulfillmentStatus;
import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentStatus;

/**
 * Partial status update. {@code null} fields are left unchanged.
 */
public record UpdateOrderStatusCommand(
        OrderStatus orderStatus,
        PaymentStatus paymentStatus,
        FulfillmentStatus fulfillmentStatus,
        String trackingNumber,
        String shippingCarrier,
        String internalNotes
) {
}
