package com.example.commerce.domain.model;

public enum Role {
    ADMIN,
    MANAGER,
    SELLER,
    CUSTOMER
}
