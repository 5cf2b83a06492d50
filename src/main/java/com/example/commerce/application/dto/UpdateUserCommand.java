package com.example.commerce.application.dto;

import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.UserStatus;

/**
 * Profile changes. Status and role changes are reserved to administrators.
 */
public record UpdateUserCommand(
        String name,
        String phone,
        String address,
        String city,
        String country,
        String postalCode,
        UserStatus status,
        Role role
) {
}
