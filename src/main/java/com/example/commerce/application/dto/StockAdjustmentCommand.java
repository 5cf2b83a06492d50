package com.example.commerce.application.dto;

import com.example.commerce.domain.model.MovementType;
import com.example.commerce.domain.model.StockOperation;

/**
 * Manual stock change requested by an operator.
 */
public record StockAdjustmentCommand(
        String productId,
        int quantity,
        StockOperation operation,
        String reason,
        MovementType type
) {
    public StockAdjustmentCommand {
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + quantity);
        }
        if (type == null) {
            type = MovementType.ADJUSTMENT;
        }
        if (!type.isManual()) {
            throw new IllegalArgumentException("Movement type not allowed for manual adjustment: " + type);
        }
    }
}
