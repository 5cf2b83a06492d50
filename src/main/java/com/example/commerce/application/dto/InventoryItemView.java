package com.example.commerce.application.dto;

import com.example.commerce.domain.model.ProductStatus;

import java.math.BigDecimal;

public record InventoryItemView(
        String productId,
        String name,
        String sku,
        String thumbnail,
        String categoryName,
        BigDecimal price,
        int stock,
        ProductStatus status,
        boolean lowStock
) {
}
