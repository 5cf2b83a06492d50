package com.example.commerce.application.service;

import com.example.commerce.application.dto.PaymentCommand;
import com.example.commerce.application.dto.PaymentInitiation;
import com.example.commerce.application.dto.PaymentMethodOption;
import com.example.commerce.application.dto.PaymentOutcome;
import com.example.commerce.application.dto.PaymentVerification;
import com.example.commerce.application.dto.PaymentView;
import com.example.commerce.application.dto.WebhookOutcome;
import com.example.commerce.application.port.in.ProcessPaymentUseCase;
import com.example.commerce.application.port.out.PaymentProvider.InitiateRequest;
import com.example.commerce.application.port.out.PaymentProvider.InitiateResult;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.PaymentMethod;
import com.example.commerce.domain.model.PaymentStatus;
import com.example.commerce.infrastructure.adapter.out.payment.PaymentGatewayAdapter;
import com.example.commerce.infrastructure.persistence.PaymentPersistenceService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Payment flows over the gateway registry.
 *
 * <p>Gateway calls run outside any transaction. Their results are recorded through
 * {@link PaymentPersistenceService} once the call completes, so a slow gateway never
 * holds a database connection.
 */
@Service
public class PaymentService implements ProcessPaymentUseCase {

    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);
    private static final List<String> CALLBACK_REFERENCE_KEYS = List.of("transactionId", "reference", "tx_ref");

    private final PaymentGatewayAdapter gateway;
    private final PaymentPersistenceService persistenceService;
    private final SettingsService settingsService;
    private final ObjectMapper objectMapper;

    public PaymentService(
            PaymentGatewayAdapter gateway,
            PaymentPersistenceService persistenceService,
            SettingsService settingsService,
            ObjectMapper objectMapper) {
        this.gateway = gateway;
        this.persistenceService = persistenceService;
        this.settingsService = settingsService;
        this.objectMapper = objectMapper;
    }

    public List<PaymentMethodOption> paymentMethods() {
        return settingsService.paymentMethods();
    }

    @Override
    public CompletableFuture<PaymentOutcome> processPayment(PaymentCommand command, Actor actor) {
        String orderNumber = persistenceService.checkPayable(command.orderId(), actor);
        log.info("Processing {} payment of {} for order {}", command.method(), command.amount(), orderNumber);

        if (!command.method().requiresProvider()) {
            String transactionId = offlineTransactionId();
            return CompletableFuture.completedFuture(
                    persistenceService.recordSettlement(command, true, transactionId, null));
        }

        PaymentMethod method = command.method();
        return gateway.initiate(method, toInitiateRequest(command))
                .thenCompose(initiation -> {
                    if (initiation.isFailed()) {
                        return CompletableFuture.completedFuture(new Settlement(initiation.transactionId(), false));
                    }
                    return gateway.verify(method, initiation.transactionId(), Map.of())
                            .thenApply(verification -> new Settlement(initiation.transactionId(),
                                    verification.success() && verification.status() == PaymentStatus.PAID));
                })
                .thenApply(settlement -> persistenceService.recordSettlement(command, settlement.paid(),
                        settlement.transactionId(), snapshot(transactionSnapshot(settlement.transactionId()))));
    }

    @Override
    public CompletableFuture<PaymentInitiation> initiatePayment(PaymentCommand command, Actor actor) {
        String orderNumber = persistenceService.checkPayable(command.orderId(), actor);
        log.info("Initiating {} payment of {} for order {}", command.method(), command.amount(), orderNumber);

        if (!command.method().requiresProvider()) {
            PaymentOutcome outcome = persistenceService.recordSettlement(
                    command, true, offlineTransactionId(), null);
            PaymentView payment = outcome.payment();
            return CompletableFuture.completedFuture(
                    new PaymentInitiation(payment.id(), payment.transactionId(), payment.status(), null));
        }

        return gateway.initiate(command.method(), toInitiateRequest(command))
                .thenApply(initiation -> persistenceService.recordInitiation(
                        command, initiation, snapshot(initiationSnapshot(initiation))));
    }

    /**
     * Handles an asynchronous gateway callback. Carries no caller identity.
     *
     * @throws IllegalArgumentException for an unknown provider slug or a callback without a reference
     */
    public CompletableFuture<WebhookOutcome> handleWebhook(String providerSlug, Map<String, Object> callback) {
        PaymentMethod method = PaymentMethod.fromProviderSlug(providerSlug)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider"));
        String transactionId = transactionReference(callback);
        if (transactionId == null) {
            throw new IllegalArgumentException("Missing transactionId");
        }
        if (!persistenceService.awaitsCallback(transactionId)) {
            log.info("Ignoring {} callback for transaction {}: already processed", method, transactionId);
            return CompletableFuture.completedFuture(WebhookOutcome.alreadyProcessed());
        }

        return gateway.verify(method, transactionId, callback)
                .thenApply(verification -> persistenceService.recordCallback(transactionId,
                        verification.success() && verification.status() == PaymentStatus.PAID,
                        snapshot(callback)));
    }

    public PaymentView getPayment(String paymentId, Actor actor) {
        return persistenceService.getPayment(paymentId, actor);
    }

    public PaymentVerification verifyPayment(String paymentId, Actor actor) {
        PaymentView payment = persistenceService.getPayment(paymentId, actor);
        boolean verified = payment.status() == PaymentStatus.PAID && payment.transactionId() != null;
        return new PaymentVerification(payment.id(), payment.status(), verified, payment.transactionId());
    }

    private static InitiateRequest toInitiateRequest(PaymentCommand command) {
        return new InitiateRequest(command.orderId(), command.amount(), command.returnUrl(), command.cancelUrl());
    }

    private static String offlineTransactionId() {
        return "COD-" + System.currentTimeMillis();
    }

    private static String transactionReference(Map<String, Object> callback) {
        if (callback == null) {
            return null;
        }
        for (String key : CALLBACK_REFERENCE_KEYS) {
            Object value = callback.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value.toString();
            }
        }
        return null;
    }

    private static Map<String, Object> transactionSnapshot(String transactionId) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("transactionId", transactionId);
        return snapshot;
    }

    private static Map<String, Object> initiationSnapshot(InitiateResult initiation) {
        Map<String, Object> snapshot = transactionSnapshot(initiation.transactionId());
        snapshot.put("status", initiation.status());
        snapshot.put("redirectUrl", initiation.redirectUrl());
        return snapshot;
    }

    private String snapshot(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize gateway payload", e);
        }
    }

    private record Settlement(String transactionId, boolean paid) {
    }
}
