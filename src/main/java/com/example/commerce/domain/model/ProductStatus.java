package com.example.commerce.domain.model;

public enum ProductStatus {
    DRAFT,
    ACTIVE,
    OUT_OF_STOCK,
    DISCONTINUED
}
