package com.example.commerce.infrastructure.adapter.in.web;

import com.example.commerce.application.dto.PaymentInitiation;
import com.example.commerce.application.dto.PaymentMethodOption;
import com.example.commerce.application.dto.PaymentOutcome;
import com.example.commerce.application.dto.PaymentVerification;
import com.example.commerce.application.dto.PaymentView;
import com.example.commerce.application.dto.WebhookOutcome;
import com.example.commerce.application.port.in.ProcessPaymentUseCase;
import com.example.commerce.application.service.PaymentService;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.infrastructure.adapter.in.web.dto.ApiEnvelope;
import com.example.commerce.infrastructure.adapter.in.web.dto.PaymentRequest;
import com.example.commerce.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import com.example.commerce.infrastructure.adapter.in.web.support.Blocking;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST controller for payments. Gateway calls are asynchronous; the response
 * completes when the attempt has been recorded.
 */
@RestController
@RequestMapping("/api/payments")
@Tag(name = "Payments", description = "Order payments through the payment gateways")
public class PaymentController {

    private static final Logger log = LoggerFactory.getLogger(PaymentController.class);

    private final ProcessPaymentUseCase processPaymentUseCase;
    private final PaymentService paymentService;
    private final OrderWebMapper mapper;

    public PaymentController(ProcessPaymentUseCase processPaymentUseCase, PaymentService paymentService,
                             OrderWebMapper mapper) {
        this.processPaymentUseCase = processPaymentUseCase;
        this.paymentService = paymentService;
        this.mapper = mapper;
    }

    @Operation(summary = "Available payment methods")
    @GetMapping("/methods")
    public Mono<ApiEnvelope<List<PaymentMethodOption>>> methods() {
        return Blocking.call(paymentService::paymentMethods).map(ApiEnvelope::ok);
    }

    @Operation(
            summary = "Pay an order",
            description = """
                    Cash on delivery and bank transfer are recorded as paid immediately. Gateway methods
                    are initiated and verified under the **paymentTL** time limiter and the **paymentCB**
                    circuit breaker; a timeout or an open circuit is recorded as a FAILED payment.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Attempt recorded, see success flag"),
            @ApiResponse(responseCode = "400", description = "Order already paid, cancelled or refunded"),
            @ApiResponse(responseCode = "403", description = "Order belongs to another customer"),
            @ApiResponse(responseCode = "404", description = "Order not found")
    })
    @PostMapping("/process")
    public Mono<ApiEnvelope<PaymentOutcome>> processPayment(Actor actor, @Valid @RequestBody PaymentRequest request) {
        return Blocking.call(() -> processPaymentUseCase.processPayment(mapper.toCommand(request), actor))
                .flatMap(Mono::fromFuture)
                .map(outcome -> new ApiEnvelope<>(outcome.success(), outcome, outcome.message(), null));
    }

    @Operation(summary = "Start a gateway payment settled later by callback")
    @PostMapping("/initiate")
    public Mono<ApiEnvelope<PaymentInitiation>> initiatePayment(Actor actor,
                                                                @Valid @RequestBody PaymentRequest request) {
        return Blocking.call(() -> processPaymentUseCase.initiatePayment(mapper.toCommand(request), actor))
                .flatMap(Mono::fromFuture)
                .map(ApiEnvelope::ok);
    }

    @Operation(summary = "Gateway callback", description = "Called by chapa, telebirr or santim_pay; no caller identity")
    @PostMapping("/webhook/{provider}")
    public Mono<ApiEnvelope<WebhookOutcome>> webhook(@PathVariable String provider,
                                                     @RequestBody(required = false) Map<String, Object> payload) {
        log.info("Webhook received from {}", provider);
        Map<String, Object> callback = payload != null ? payload : Map.of();
        return Blocking.call(() -> paymentService.handleWebhook(provider, callback))
                .flatMap(Mono::fromFuture)
                .map(outcome -> ApiEnvelope.ok(outcome, outcome.message()));
    }

    @Operation(summary = "Get a payment")
    @GetMapping("/{paymentId}")
    public Mono<ApiEnvelope<PaymentView>> getPayment(Actor actor, @PathVariable String paymentId) {
        return Blocking.call(() -> paymentService.getPayment(paymentId, actor)).map(ApiEnvelope::ok);
    }

    @Operation(summary = "Check whether a payment is settled")
    @PostMapping("/{paymentId}/verify")
    public Mono<ApiEnvelope<PaymentVerification>> verifyPayment(Actor actor, @PathVariable String paymentId) {
        return Blocking.call(() -> paymentService.verifyPayment(paymentId, actor)).map(ApiEnvelope::ok);
    }
}
