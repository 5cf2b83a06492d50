package com.example.commerce.application.dto;

import com.example.commerce.domain.model.ProductStatus;

import java.math.BigDecimal;

public record ProductQuery(
        String search,
        String categoryId,
        ProductStatus status,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        PageQuery page
) {
}
