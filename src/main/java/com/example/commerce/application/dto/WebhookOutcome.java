package com.example.commerce.application.dto;

import com.example.commerce.domain.model.PaymentStatus;

/**
 * Acknowledgement returned to a gateway callback.
 */
public record WebhookOutcome(boolean processed, String message, PaymentStatus status) {

    public static WebhookOutcome alreadyProcessed() {
        return new WebhookOutcome(false, "Already processed", null);
    }
}
