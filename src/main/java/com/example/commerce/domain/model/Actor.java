package com.example.commerce.domain.model;

import com.example.commerce.domain.exception.ForbiddenException;

import java.util.Arrays;
import java.util.Objects;

/**
 * The authenticated caller of an operation, as forwarded by the gateway.
 */
public record Actor(String userId, Role role) {

    public Actor {
        Objects.requireNonNull(userId, "userId cannot be null");
        Objects.requireNonNull(role, "role cannot be null");
    }

    public static Actor of(String userId, Role role) {
        return new Actor(userId, role);
    }

    /**
     * Staff roles may act on resources owned by other users.
     */
    public boolean isElevated() {
        return role != Role.CUSTOMER;
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean hasAnyRole(Role... roles) {
        return Arrays.asList(roles).contains(role);
    }

    /**
     * @throws ForbiddenException if the caller holds none of the given roles
     */
    public void requireAnyRole(Role... roles) {
        if (!hasAnyRole(roles)) {
            throw new ForbiddenException("Insufficient permissions");
        }
    }

    /**
     * @throws ForbiddenException unless the caller owns the resource or holds a staff role
     */
    public void requireOwnerOrElevated(String ownerId) {
        if (!isElevated() && !userId.equals(ownerId)) {
            throw new ForbiddenException("Access denied");
        }
    }
}
