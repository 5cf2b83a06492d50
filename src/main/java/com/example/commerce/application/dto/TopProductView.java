package com.example.commerce.application.dto;

import java.math.BigDecimal;

public record TopProductView(
        String id,
        String name,
        String thumbnail,
        BigDecimal price,
        int salesCount,
        String categoryName
) {
}
