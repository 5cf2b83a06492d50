package com.example.commerce.application.dto;

import com.example.commerce.domain.model.ProductStatus;

import java.math.BigDecimal;
import java.time.Instant;

public record ProductView(
        String id,
        String name,
        String slug,
        String description,
        String sku,
        BigDecimal price,
        BigDecimal comparePrice,
        int stock,
        boolean trackInventory,
        ProductStatus status,
        int salesCount,
        int viewCount,
        String categoryId,
        String categoryName,
        String thumbnail,
        Instant publishedAt,
        Instant createdAt
) {
}
