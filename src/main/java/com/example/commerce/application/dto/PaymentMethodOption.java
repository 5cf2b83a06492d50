package com.example.commerce.application.dto;

import com.example.commerce.domain.model.PaymentMethod;

public record PaymentMethodOption(PaymentMethod method, String name, boolean enabled) {
}
