package com.example.commerce.application.dto;

import com.example.commerce.domain.model.PaymentStatus;

public record PaymentInitiation(String paymentId, String transactionId, PaymentStatus status, String redirectUrl) {
}
