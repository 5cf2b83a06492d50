package com.example.commerce.infrastructure.persistence;

import com.example.commerce.application.dto.PaymentCommand;
import com.example.commerce.application.dto.PaymentInitiation;
import com.example.commerce.application.dto.PaymentOutcome;
import com.example.commerce.application.dto.PaymentView;
import com.example.commerce.application.dto.WebhookOutcome;
import com.example.commerce.application.port.out.PaymentProvider.InitiateResult;
import com.example.commerce.application.service.NotificationService;
import com.example.commerce.domain.exception.InvalidStateException;
import com.example.commerce.domain.exception.NotFoundException;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.NotificationType;
import com.example.commerce.domain.model.OrderStateMachine;
import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentStatus;
import com.example.commerce.infrastructure.persistence.entity.OrderEntity;
import com.example.commerce.infrastructure.persistence.entity.PaymentEntity;
import com.example.commerce.infrastructure.persistence.mapper.PaymentPersistenceMapper;
import com.example.commerce.infrastructure.persistence.repository.OrderRepository;
import com.example.commerce.infrastructure.persistence.repository.PaymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Transactional side of payments. Gateway calls happen outside these methods;
 * each method records the result of one call together with the order update
 * and the customer notification.
 */
@Service
public class PaymentPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(PaymentPersistenceService.class);

    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;
    private final NotificationService notificationService;
    private final PaymentPersistenceMapper mapper;

    public PaymentPersistenceService(
            OrderRepository orderRepository,
            PaymentRepository paymentRepository,
            NotificationService notificationService,
            PaymentPersistenceMapper mapper) {
        this.orderRepository = orderRepository;
        this.paymentRepository = paymentRepository;
        this.notificationService = notificationService;
        this.mapper = mapper;
    }

    /**
     * Checks that the caller may pay the order right now. Advisory only: the recording
     * methods re-check under the order lock once the gateway has answered.
     *
     * @return the order number, for logging and gateway references
     */
    @Transactional(readOnly = true)
    public String checkPayable(String orderId, Actor actor) {
        OrderEntity order = orderRepository.findById(orderId)
                .orElseThrow(() -> new NotFoundException("Order", orderId));
        requirePayable(order);
        actor.requireOwnerOrElevated(order.getUser().getId());
        return order.getOrderNumber();
    }

    /**
     * Records a settled attempt, PAID or FAILED. A PAID attempt also settles the order.
     *
     * <p>A gateway attempt for an order that stopped being payable while the gateway was
     * working is kept as an unapplied row and leaves the order untouched.
     */
    @Transactional
    public PaymentOutcome recordSettlement(PaymentCommand command, boolean paid, String transactionId,
                                           String gatewayResponse) {
        OrderEntity order = lockOrder(command.orderId());
        String refusal = refusalFor(order);
        if (refusal != null) {
            if (!command.method().requiresProvider()) {
                throw new InvalidStateException(refusal);
            }
            PaymentEntity payment = recordUnapplied(order, command, paid, transactionId, gatewayResponse, refusal);
            return PaymentOutcome.unapplied(mapper.toView(payment));
        }

        PaymentStatus status = paid ? PaymentStatus.PAID : PaymentStatus.FAILED;
        PaymentEntity payment = paymentRepository.save(PaymentEntity.attempt(
                order, command.amount(), command.method(), status, transactionId, gatewayResponse));

        if (paid) {
            settleOrder(order);
        } else {
            notifyFailure(order);
        }

        log.info("Payment {} for order {} recorded as {} (method={}, transactionId={})",
                payment.getId(), order.getOrderNumber(), status, command.method(), transactionId);
        PaymentView view = mapper.toView(payment);
        return paid ? PaymentOutcome.succeeded(view) : PaymentOutcome.failed(view);
    }

    /**
     * Records an initiated gateway payment awaiting its callback.
     */
    @Transactional
    public PaymentInitiation recordInitiation(PaymentCommand command, InitiateResult result, String gatewayResponse) {
        OrderEntity order = lockOrder(command.orderId());
        String refusal = refusalFor(order);
        if (refusal != null) {
            PaymentEntity payment = recordUnapplied(order, command, result.status() == PaymentStatus.PAID,
                    result.transactionId(), gatewayResponse, refusal);
            return new PaymentInitiation(payment.getId(), result.transactionId(), payment.getStatus(), null);
        }

        PaymentEntity payment = paymentRepository.save(PaymentEntity.attempt(
                order, command.amount(), command.method(), result.status(), result.transactionId(), gatewayResponse));

        if (result.status() == PaymentStatus.PAID) {
            settleOrder(order);
        } else if (result.isFailed()) {
            notifyFailure(order);
        }

        log.info("Payment {} initiated for order {} with status {} (transactionId={})",
                payment.getId(), order.getOrderNumber(), result.status(), result.transactionId());
        return new PaymentInitiation(payment.getId(), result.transactionId(), result.status(), result.redirectUrl());
    }

    /**
     * Whether a recorded, unsettled payment exists for the gateway transaction.
     */
    @Transactional(readOnly = true)
    public boolean awaitsCallback(String transactionId) {
        return paymentRepository.findFirstByTransactionId(transactionId)
                .map(payment -> !payment.isPaid() && !payment.isUnapplied())
                .orElse(false);
    }

    /**
     * Applies a gateway callback. The payment row is locked first, then its order.
     *
     * @return the acknowledgement for the gateway; not processed when the payment was
     *         settled or set aside in the meantime
     */
    @Transactional
    public WebhookOutcome recordCallback(String transactionId, boolean verified, String gatewayResponse) {
        PaymentEntity payment = paymentRepository.findByTransactionIdForUpdate(transactionId).stream()
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Payment", transactionId));
        if (payment.isPaid() || payment.isUnapplied()) {
            return WebhookOutcome.alreadyProcessed();
        }
        if (!verified) {
            payment.markFailed(gatewayResponse);
            notifyFailure(payment.getOrder());
            log.warn("Callback for transaction {} did not verify", transactionId);
            return new WebhookOutcome(true, "Payment verification failed", PaymentStatus.FAILED);
        }

        OrderEntity order = lockOrder(payment.getOrder().getId());
        String refusal = refusalFor(order);
        if (refusal != null) {
            payment.markUnapplied(gatewayResponse, refusal);
            log.warn("Callback captured payment {} for order {} which is not payable ({}); refund required",
                    payment.getId(), order.getOrderNumber(), refusal);
            return new WebhookOutcome(true, refusal, PaymentStatus.FAILED);
        }

        payment.markPaid(gatewayResponse);
        settleOrder(order);
        log.info("Callback settled payment {} for order {}", payment.getId(), order.getOrderNumber());
        return new WebhookOutcome(true, "Payment verified", PaymentStatus.PAID);
    }

    @Transactional(readOnly = true)
    public PaymentView getPayment(String paymentId, Actor actor) {
        PaymentEntity payment = load(paymentId);
        actor.requireOwnerOrElevated(payment.getOrder().getUser().getId());
        return mapper.toView(payment);
    }

    private PaymentEntity load(String paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> new NotFoundException("Payment", paymentId));
    }

    private OrderEntity lockOrder(String orderId) {
        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new NotFoundException("Order", orderId));
    }

    private static void requirePayable(OrderEntity order) {
        String refusal = refusalFor(order);
        if (refusal != null) {
            throw new InvalidStateException(refusal);
        }
    }

    /**
     * Why the order cannot take a payment, or {@code null} when it can. A FAILED
     * payment status is retried through PENDING.
     */
    private static String refusalFor(OrderEntity order) {
        if (order.getOrderStatus() == OrderStatus.CANCELLED || order.getOrderStatus() == OrderStatus.REFUNDED) {
            return "Cannot pay for an order in status " + order.getOrderStatus();
        }
        PaymentStatus current = order.getPaymentStatus();
        if (current == PaymentStatus.PAID) {
            return "Order already paid";
        }
        boolean retry = current == PaymentStatus.FAILED
                && OrderStateMachine.canTransition(current, PaymentStatus.PENDING);
        if (!retry && !OrderStateMachine.canTransition(current, PaymentStatus.PAID)) {
            return "Cannot pay for an order with payment status " + current;
        }
        return null;
    }

    private PaymentEntity recordUnapplied(OrderEntity order, PaymentCommand command, boolean captured,
                                          String transactionId, String gatewayResponse, String refusal) {
        PaymentEntity payment = paymentRepository.save(PaymentEntity.unapplied(
                order, command.amount(), command.method(), transactionId, gatewayResponse, refusal));
        if (captured) {
            log.warn("Gateway captured payment {} for order {} which is not payable ({}); refund required "
                    + "(method={}, transactionId={})", payment.getId(), order.getOrderNumber(), refusal,
                    command.method(), transactionId);
        } else {
            log.info("Payment {} for order {} kept unapplied: {}", payment.getId(), order.getOrderNumber(), refusal);
        }
        return payment;
    }

    private void settleOrder(OrderEntity order) {
        Instant now = Instant.now();
        if (order.getPaymentStatus() == PaymentStatus.FAILED) {
            order.movePaymentTo(PaymentStatus.PENDING, now);
        }
        OrderStateMachine.validateTransition(order.getPaymentStatus(), PaymentStatus.PAID);
        order.movePaymentTo(PaymentStatus.PAID, now);
        if (order.getOrderStatus() == OrderStatus.PENDING) {
            order.moveTo(OrderStatus.CONFIRMED, now);
        }
        notificationService.notify(order.getUser().getId(), NotificationType.PAYMENT_RECEIVED,
                "Payment received",
                "Payment for order " + order.getOrderNumber() + " has been received",
                "/orders/" + order.getId());
    }

    private void notifyFailure(OrderEntity order) {
        notificationService.notify(order.getUser().getId(), NotificationType.PAYMENT_FAILED,
                "Payment failed",
                "Payment for order " + order.getOrderNumber() + " could not be completed",
                "/orders/" + order.getId());
    }
}
