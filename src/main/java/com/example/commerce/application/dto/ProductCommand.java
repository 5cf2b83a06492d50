package com.example.commerce.application.dto;

import com.example.commerce.domain.model.ProductStatus;

import java.math.BigDecimal;

/**
 * Product attributes for create and update. On update, {@code null} fields are left unchanged.
 */
public record ProductCommand(
        String name,
        String description,
        String sku,
        BigDecimal price,
        BigDecimal comparePrice,
        BigDecimal costPrice,
        Integer stock,
        Boolean trackInventory,
        ProductStatus status,
        String categoryId,
        String thumbnail
) {
}
