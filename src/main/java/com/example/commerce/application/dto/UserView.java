package com.example.commerce.application.dto;

import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.UserStatus;

import java.math.BigDecimal;
import java.time.Instant;

public record UserView(
        String id,
        String name,
        String email,
        String phone,
        Role role,
        UserStatus status,
        String address,
        String city,
        String country,
        String postalCode,
        int totalOrders,
        BigDecimal totalSpent,
        Instant createdAt
) {
}
