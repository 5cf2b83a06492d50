package com.example.commerce.application.dto;

import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentMethod;
import com.example.commerce.domain.model.PaymentStatus;

public record OrderQuery(
        String search,
        OrderStatus orderStatus,
        PaymentStatus paymentStatus,
        PaymentMethod paymentMethod,
        String userId,
        PageQuery page
) {
}
