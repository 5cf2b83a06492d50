package com.example.commerce.infrastructure.adapter.in.web.dto;

import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.UserStatus;
import jakarta.validation.constraints.Size;

public record UpdateUserRequest(
        @Size(min = 2, max = 100, message = "Name must be between 2 and 100 characters")
        String name,

        @Size(max = 32) String phone,
        String address,
        String city,
        String country,
        String postalCode,
        UserStatus status,
        Role role
) {
}
