package com.example.commerce.application.port.in;

import com.example.commerce.application.dto.PaymentCommand;
import com.example.commerce.application.dto.PaymentInitiation;
import com.example.commerce.application.dto.PaymentOutcome;
import com.example.commerce.domain.model.Actor;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound port for paying orders. Gateway calls are asynchronous.
 */
public interface ProcessPaymentUseCase {

    /**
     * Initiates and verifies a payment in one step, recording the attempt.
     */
    CompletableFuture<PaymentOutcome> processPayment(PaymentCommand command, Actor actor);

    /**
     * Starts a payment whose settlement arrives later through a gateway callback.
     */
    CompletableFuture<PaymentInitiation> initiatePayment(PaymentCommand command, Actor actor);
}
