package com.example.commerce.application.dto;

import com.example.commerce.domain.model.PaymentStatus;

public record PaymentVerification(String paymentId, PaymentStatus status, boolean verified, String transactionId) {
}
