package com.example.commerce.infrastructure.adapter.in.web.dto;

import com.example.commerce.domain.model.MovementType;
import com.example.commerce.domain.model.StockOperation;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Manual stock change. Operation is one of increase, decrease or set.
 */
public record StockUpdateRequest(
        @NotNull(message = "Quantity is required")
        @Min(value = 0, message = "Quantity cannot be negative")
        Integer quantity,

        @NotNull(message = "Operation is required")
        StockOperation operation,

        @Size(max = 500, message = "Reason cannot exceed 500 characters")
        String reason,

        MovementType type
) {
}
