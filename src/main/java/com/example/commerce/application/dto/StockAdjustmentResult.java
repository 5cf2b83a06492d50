package com.example.commerce.application.dto;

import com.example.commerce.domain.model.ProductStatus;

public record StockAdjustmentResult(
        String productId,
        String productName,
        int previousStock,
        int newStock,
        int delta,
        ProductStatus status
) {
}
