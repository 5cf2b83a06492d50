package com.example.commerce.application.port.out;

import com.example.commerce.domain.model.PaymentStatus;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for a payment gateway.
 */
public interface PaymentProvider {

    /**
     * Starts a payment with the gateway.
     *
     * @param request order reference, amount and optional redirect targets
     * @return future with the gateway transaction and its initial status
     */
    CompletableFuture<InitiateResult> initiate(InitiateRequest request);

    /**
     * Confirms the outcome of a transaction.
     *
     * @param transactionId the gateway transaction id
     * @param callback      raw callback payload when verifying a webhook, or empty
     * @return future with the verification outcome
     */
    CompletableFuture<VerifyResult> verify(String transactionId, Map<String, Object> callback);

    record InitiateRequest(String orderId, BigDecimal amount, String returnUrl, String cancelUrl) {
    }

    /**
     * Outcome of an initiation. Status is one of PENDING, PAID or FAILED.
     */
    record InitiateResult(String transactionId, PaymentStatus status, String redirectUrl) {

        public static InitiateResult failed(String transactionId) {
            return new InitiateResult(transactionId, PaymentStatus.FAILED, null);
        }

        public boolean isFailed() {
            return status == PaymentStatus.FAILED;
        }
    }

    record VerifyResult(boolean success, PaymentStatus status) {

        public static VerifyResult failed() {
            return new VerifyResult(false, PaymentStatus.FAILED);
        }
    }
}
