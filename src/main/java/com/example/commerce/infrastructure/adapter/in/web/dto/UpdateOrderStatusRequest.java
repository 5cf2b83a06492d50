package com.example.commerce.infrastructure.adapter.in.web.dto;

import com.example.commerce.domain.model.FulfillmentStatus;
import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentStatus;
import jakarta.validation.constraints.Size;

public record UpdateOrderStatusRequest(
        OrderStatus orderStatus,
        PaymentStatus paymentStatus,
        FulfillmentStatus fulfillmentStatus,
        @Size(max = 100) String trackingNumber,
        @Size(max = 100) String shippingCarrier,
        @Size(max = 2000) String internalNotes
) {
}
