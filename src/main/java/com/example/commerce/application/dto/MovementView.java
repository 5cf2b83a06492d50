package com.example.commerce.application.dto;

import com.example.commerce.domain.model.MovementType;

import java.time.Instant;

public record MovementView(
        String id,
        String productId,
        int quantityDelta,
        MovementType type,
        String reason,
        String referenceId,
        String userId,
        Instant createdAt
) {
}
