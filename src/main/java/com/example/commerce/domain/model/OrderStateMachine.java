package com.example.commerce.domain.model;

import com.example.commerce.domain.exception.InvalidTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed status transitions for orders and payments.
 *
 * <p>Transitions are table-driven. A requested status equal to the current one
 * is treated as a no-op and never rejected.
 */
public final class OrderStateMachine {

    private static final Map<OrderStatus, Set<OrderStatus>> ORDER_TRANSITIONS;
    private static final Map<PaymentStatus, Set<PaymentStatus>> PAYMENT_TRANSITIONS;

    static {
        Map<OrderStatus, Set<OrderStatus>> order = new EnumMap<>(OrderStatus.class);
        order.put(OrderStatus.PENDING, EnumSet.of(OrderStatus.CONFIRMED, OrderStatus.CANCELLED));
        order.put(OrderStatus.CONFIRMED, EnumSet.of(OrderStatus.PROCESSING, OrderStatus.CANCELLED));
        order.put(OrderStatus.PROCESSING, EnumSet.of(OrderStatus.SHIPPED, OrderStatus.CANCELLED));
        order.put(OrderStatus.SHIPPED, EnumSet.of(OrderStatus.DELIVERED, OrderStatus.CANCELLED));
        order.put(OrderStatus.DELIVERED, EnumSet.of(OrderStatus.REFUNDED));
        order.put(OrderStatus.CANCELLED, EnumSet.noneOf(OrderStatus.class));
        order.put(OrderStatus.REFUNDED, EnumSet.noneOf(OrderStatus.class));
        ORDER_TRANSITIONS = Collections.unmodifiableMap(order);

        Map<PaymentStatus, Set<PaymentStatus>> payment = new EnumMap<>(PaymentStatus.class);
        payment.put(PaymentStatus.PENDING, EnumSet.of(PaymentStatus.PAID, PaymentStatus.FAILED));
        payment.put(PaymentStatus.PAID, EnumSet.of(PaymentStatus.REFUNDED, PaymentStatus.PARTIALLY_REFUNDED));
        payment.put(PaymentStatus.FAILED, EnumSet.of(PaymentStatus.PENDING));
        payment.put(PaymentStatus.REFUNDED, EnumSet.noneOf(PaymentStatus.class));
        payment.put(PaymentStatus.PARTIALLY_REFUNDED, EnumSet.of(PaymentStatus.REFUNDED));
        PAYMENT_TRANSITIONS = Collections.unmodifiableMap(payment);
    }

    private OrderStateMachine() {
    }

    public static boolean canTransition(OrderStatus from, OrderStatus to) {
        return from == to || ORDER_TRANSITIONS.get(from).contains(to);
    }

    public static boolean canTransition(PaymentStatus from, PaymentStatus to) {
        return from == to || PAYMENT_TRANSITIONS.get(from).contains(to);
    }

    /**
     * @throws InvalidTransitionException if the order status edge is not allowed
     */
    public static void validateTransition(OrderStatus from, OrderStatus to) {
        if (!canTransition(from, to)) {
            throw new InvalidTransitionException("order", from.name(), to.name());
        }
    }

    /**
     * @throws InvalidTransitionException if the payment status edge is not allowed
     */
    public static void validateTransition(PaymentStatus from, PaymentStatus to) {
        if (!canTransition(from, to)) {
            throw new InvalidTransitionException("payment", from.name(), to.name());
        }
    }

    public static Set<OrderStatus> allowedTransitions(OrderStatus from) {
        return Collections.unmodifiableSet(ORDER_TRANSITIONS.get(from));
    }

    public static Set<PaymentStatus> allowedTransitions(PaymentStatus from) {
        return Collections.unmodifiableSet(PAYMENT_TRANSITIONS.get(from));
    }

    /**
     * Order status implied by a payment status when no order status is requested.
     */
    public static OrderStatus orderStatusFromPayment(PaymentStatus paymentStatus) {
        return switch (paymentStatus) {
            case PAID -> OrderStatus.CONFIRMED;
            case REFUNDED -> OrderStatus.REFUNDED;
            case FAILED, PENDING, PARTIALLY_REFUNDED -> OrderStatus.PENDING;
        };
    }

    /**
     * Resolves the target statuses of a status update.
     *
     * <p>Explicit statuses are validated against the tables. When only a payment
     * status is requested, the order status is derived from it without validation.
     *
     * @param currentOrder     current order status
     * @param currentPayment   current payment status
     * @param requestedOrder   requested order status, or {@code null}
     * @param requestedPayment requested payment status, or {@code null}
     * @return the statuses the order should end up in
     * @throws InvalidTransitionException if an explicit status edge is not allowed
     */
    public static StatusChange resolve(OrderStatus currentOrder, PaymentStatus currentPayment,
                                       OrderStatus requestedOrder, PaymentStatus requestedPayment) {
        OrderStatus targetOrder = currentOrder;
        PaymentStatus targetPayment = currentPayment;

        if (requestedOrder != null) {
            validateTransition(currentOrder, requestedOrder);
            targetOrder = requestedOrder;
        }
        if (requestedPayment != null) {
            validateTransition(currentPayment, requestedPayment);
            targetPayment = requestedPayment;
            if (requestedOrder == null && requestedPayment != currentPayment) {
                targetOrder = orderStatusFromPayment(requestedPayment);
            }
        }
        return new StatusChange(targetOrder, targetPayment);
    }

    /**
     * Outcome of {@link #resolve}.
     */
    public record StatusChange(OrderStatus orderStatus, PaymentStatus paymentStatus) {
    }
}
