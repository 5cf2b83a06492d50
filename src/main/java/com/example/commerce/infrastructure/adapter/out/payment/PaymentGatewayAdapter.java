package com.example.commerce.infrastructure.adapter.out.payment;

import com.example.commerce.application.port.out.PaymentProvider;
import com.example.commerce.application.port.out.PaymentProvider.InitiateRequest;
import com.example.commerce.application.port.out.PaymentProvider.InitiateResult;
import com.example.commerce.application.port.out.PaymentProvider.VerifyResult;
import com.example.commerce.domain.exception.InvalidStateException;
import com.example.commerce.domain.model.PaymentMethod;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Calls the registered gateway for a payment method under a time limit and a
 * circuit breaker. A timeout, an open circuit or a provider error becomes a
 * FAILED initiation or an unsuccessful verification, never an exception.
 */
@Component
public class PaymentGatewayAdapter {

    private static final Logger log = LoggerFactory.getLogger(PaymentGatewayAdapter.class);

    private final PaymentProviderRegistry registry;

    public PaymentGatewayAdapter(PaymentProviderRegistry registry) {
        this.registry = registry;
    }

    @TimeLimiter(name = "paymentTL")
    @CircuitBreaker(name = "paymentCB", fallbackMethod = "initiateFallback")
    public CompletableFuture<InitiateResult> initiate(PaymentMethod method, InitiateRequest request) {
        log.debug("Initiating {} payment for order {}", method, request.orderId());
        return provider(method).initiate(request);
    }

    @TimeLimiter(name = "paymentTL")
    @CircuitBreaker(name = "paymentCB", fallbackMethod = "verifyFallback")
    public CompletableFuture<VerifyResult> verify(PaymentMethod method, String transactionId,
                                                  Map<String, Object> callback) {
        log.debug("Verifying {} transaction {}", method, transactionId);
        return provider(method).verify(transactionId, callback);
    }

    public boolean supports(PaymentMethod method) {
        return registry.find(method).isPresent();
    }

    private PaymentProvider provider(PaymentMethod method) {
        return registry.find(method)
                .orElseThrow(() -> new InvalidStateException("Invalid payment method: " + method));
    }

    @SuppressWarnings("unused")
    private CompletableFuture<InitiateResult> initiateFallback(PaymentMethod method, InitiateRequest request,
                                                               Throwable throwable) {
        if (throwable instanceof InvalidStateException invalid) {
            return CompletableFuture.failedFuture(invalid);
        }
        log.warn("Payment initiation via {} failed for order {}: {}",
                method, request.orderId(), describe(throwable));
        return CompletableFuture.completedFuture(InitiateResult.failed(null));
    }

    @SuppressWarnings("unused")
    private CompletableFuture<VerifyResult> verifyFallback(PaymentMethod method, String transactionId,
                                                           Map<String, Object> callback, Throwable throwable) {
        if (throwable instanceof InvalidStateException invalid) {
            return CompletableFuture.failedFuture(invalid);
        }
        log.warn("Payment verification via {} failed for transaction {}: {}",
                method, transactionId, describe(throwable));
        return CompletableFuture.completedFuture(VerifyResult.failed());
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return throwable.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
