package com.example.commerce.infrastructure.adapter.out.payment;

import com.example.commerce.application.port.out.PaymentProvider;
import com.example.commerce.domain.model.PaymentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Simulated gateway standing in for the Chapa, Telebirr and SantimPay integrations.
 *
 * <p>Initiation completes after a fixed delay and fails with the configured
 * probability. Verification always reports the transaction as paid.
 */
public class MockPaymentProvider implements PaymentProvider {

    private static final Logger log = LoggerFactory.getLogger(MockPaymentProvider.class);
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final Duration initiateDelay;
    private final Duration verifyDelay;
    private final double failureRate;
    private final String redirectBaseUrl;
    private final Random random;

    public MockPaymentProvider(Duration initiateDelay, Duration verifyDelay, double failureRate,
                               String redirectBaseUrl, Random random) {
        if (failureRate < 0.0 || failureRate > 1.0) {
            throw new IllegalArgumentException("Failure rate must be within [0, 1]: " + failureRate);
        }
        this.initiateDelay = initiateDelay;
        this.verifyDelay = verifyDelay;
        this.failureRate = failureRate;
        this.redirectBaseUrl = redirectBaseUrl;
        this.random = random;
    }

    @Override
    public CompletableFuture<InitiateResult> initiate(InitiateRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String transactionId = "MOCK-" + System.currentTimeMillis() + "-" + randomSuffix();
            boolean failed = random.nextDouble() < failureRate;
            log.debug("Mock initiate: order={}, amount={}, transactionId={}, failed={}",
                    request.orderId(), request.amount(), transactionId, failed);
            if (failed) {
                return InitiateResult.failed(transactionId);
            }
            String redirectUrl = redirectBaseUrl == null || redirectBaseUrl.isBlank()
                    ? null
                    : redirectBaseUrl + "/" + transactionId;
            return new InitiateResult(transactionId, PaymentStatus.PENDING, redirectUrl);
        }, after(initiateDelay));
    }

    @Override
    public CompletableFuture<VerifyResult> verify(String transactionId, Map<String, Object> callback) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Mock verify: transactionId={}", transactionId);
            return new VerifyResult(true, PaymentStatus.PAID);
        }, after(verifyDelay));
    }

    private static Executor after(Duration delay) {
        return CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private String randomSuffix() {
        StringBuilder suffix = new StringBuilder(8);
        for (int i = 0; i < 8; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return suffix.toString();
    }
}
