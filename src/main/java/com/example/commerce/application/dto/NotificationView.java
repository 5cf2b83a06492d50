package com.example.commerce.application.dto;

import com.example.commerce.domain.model.NotificationType;

import java.time.Instant;

public record NotificationView(
        String id,
        NotificationType type,
        String title,
        String message,
        String link,
        boolean read,
        Instant readAt,
        Instant createdAt
) {
}
