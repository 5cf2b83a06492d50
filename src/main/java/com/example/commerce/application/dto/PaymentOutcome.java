package com.example.commerce.application.dto;

/**
 * Result of processing a payment. A failed gateway attempt is still a recorded outcome.
 */
public record PaymentOutcome(boolean success, String message, PaymentView payment) {

    public static PaymentOutcome succeeded(PaymentView payment) {
        return new PaymentOutcome(true, "Payment processed successfully", payment);
    }

    public static PaymentOutcome failed(PaymentView payment) {
        return new PaymentOutcome(false, "Payment failed", payment);
    }

    /**
     * The attempt was recorded but the order could no longer take it.
     */
    public static PaymentOutcome unapplied(PaymentView payment) {
        return new PaymentOutcome(false, payment.failureReason(), payment);
    }
}
