package com.example.commerce.application.dto;

import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.UserStatus;

public record CreateUserCommand(
        String name,
        String email,
        String phone,
        Role role,
        UserStatus status,
        String address,
        String city,
        String country,
        String postalCode
) {
}
