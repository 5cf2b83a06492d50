package com.example.commerce.infrastructure.adapter.in.web.dto;

import com.example.commerce.domain.model.ProductStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Product payload. Name and price are required on create; omitted fields are kept on update.
 */
public record ProductRequest(
        @NotBlank(groups = OnCreate.class, message = "Name is required")
        @Size(min = 2, max = 200, message = "Name must be between 2 and 200 characters")
        String name,

        String description,

        @Size(max = 64, message = "SKU cannot exceed 64 characters")
        String sku,

        @NotNull(groups = OnCreate.class, message = "Price is required")
        @DecimalMin(value = "0.00", message = "Price cannot be negative")
        BigDecimal price,

        @DecimalMin(value = "0.00", message = "Compare price cannot be negative")
        BigDecimal comparePrice,

        @DecimalMin(value = "0.00", message = "Cost price cannot be negative")
        BigDecimal costPrice,

        @Min(value = 0, message = "Stock cannot be negative")
        Integer stock,

        Boolean trackInventory,
        ProductStatus status,
        String categoryId,
        String thumbnail
) {}
