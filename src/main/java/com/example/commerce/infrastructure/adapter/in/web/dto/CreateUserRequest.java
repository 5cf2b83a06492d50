package com.example.commerce.infrastructure.adapter.in.web.dto;

import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.UserStatus;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @NotBlank(message = "Name is required")
        @Size(min = 2, max = 100, message = "Name must be between 2 and 100 characters")
        String name,

        @NotBlank(message = "Email is required")
        @Email(message = "Invalid email address")
        String email,

        @Size(max = 32) String phone,
        Role role,
        UserStatus status,
        String address,
        String city,
        String country,
        String postalCode
) {
}
