package com.example.commerce.unit.domain;

import com.example.commerce.domain.exception.InvalidStateException;
import com.example.commerce.domain.exception.InvalidTransitionException;
import com.example.commerce.domain.model.OrderStateMachine;
import com.example.commerce.domain.model.OrderStateMachine.StatusChange;
import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the order and payment transition tables. Every pair of statuses is
 * checked against the edges listed here.
 */
class OrderStateMachineTest {

    private static final Map<OrderStatus, Set<OrderStatus>> ORDER_EDGES = Map.of(
            OrderStatus.PENDING, EnumSet.of(OrderStatus.CONFIRMED, OrderStatus.CANCELLED),
            OrderStatus.CONFIRMED, EnumSet.of(OrderStatus.PROCESSING, OrderStatus.CANCELLED),
            OrderStatus.PROCESSING, EnumSet.of(OrderStatus.SHIPPED, OrderStatus.CANCELLED),
            OrderStatus.SHIPPED, EnumSet.of(OrderStatus.DELIVERED, OrderStatus.CANCELLED),
            OrderStatus.DELIVERED, EnumSet.of(OrderStatus.REFUNDED),
            OrderStatus.CANCELLED, EnumSet.noneOf(OrderStatus.class),
            OrderStatus.REFUNDED, EnumSet.noneOf(OrderStatus.class));

    private static final Map<PaymentStatus, Set<PaymentStatus>> PAYMENT_EDGES = Map.of(
            PaymentStatus.PENDING, EnumSet.of(PaymentStatus.PAID, PaymentStatus.FAILED),
            PaymentStatus.PAID, EnumSet.of(PaymentStatus.REFUNDED, PaymentStatus.PARTIALLY_REFUNDED),
            PaymentStatus.FAILED, EnumSet.of(PaymentStatus.PENDING),
            PaymentStatus.PARTIALLY_REFUNDED, EnumSet.of(PaymentStatus.REFUNDED),
            PaymentStatus.REFUNDED, EnumSet.noneOf(PaymentStatus.class));

    static Stream<Arguments> allowedOrderEdges() {
        return orderPairs().filter(pair -> isOrderEdge((OrderStatus) pair.get()[0], (OrderStatus) pair.get()[1]));
    }

    static Stream<Arguments> rejectedOrderEdges() {
        return orderPairs().filter(pair -> !isOrderEdge((OrderStatus) pair.get()[0], (OrderStatus) pair.get()[1]));
    }

    static Stream<Arguments> allowedPaymentEdges() {
        return paymentPairs().filter(pair -> isPaymentEdge((PaymentStatus) pair.get()[0], (PaymentStatus) pair.get()[1]));
    }

    static Stream<Arguments> rejectedPaymentEdges() {
        return paymentPairs().filter(pair -> !isPaymentEdge((PaymentStatus) pair.get()[0], (PaymentStatus) pair.get()[1]));
    }

    private static Stream<Arguments> orderPairs() {
        return Arrays.stream(OrderStatus.values())
                .flatMap(from -> Arrays.stream(OrderStatus.values()).map(to -> Arguments.of(from, to)));
    }

    private static Stream<Arguments> paymentPairs() {
        return Arrays.stream(PaymentStatus.values())
                .flatMap(from -> Arrays.stream(PaymentStatus.values()).map(to -> Arguments.of(from, to)));
    }

    private static boolean isOrderEdge(OrderStatus from, OrderStatus to) {
        return from == to || ORDER_EDGES.get(from).contains(to);
    }

    private static boolean isPaymentEdge(PaymentStatus from, PaymentStatus to) {
        return from == to || PAYMENT_EDGES.get(from).contains(to);
    }

    @Test
    @DisplayName("should_list_every_status_in_the_expected_tables")
    void should_list_every_status_in_the_expected_tables() {
        assertThat(ORDER_EDGES).containsOnlyKeys(OrderStatus.values());
        assertThat(PAYMENT_EDGES).containsOnlyKeys(PaymentStatus.values());
    }

    @Nested
    @DisplayName("Order transitions")
    class OrderTransitions {

        @ParameterizedTest(name = "{0} -> {1}")
        @MethodSource("com.example.commerce.unit.domain.OrderStateMachineTest#allowedOrderEdges")
        @DisplayName("should_allow_listed_edges_and_same_status")
        void should_allow_listed_edges_and_same_status(OrderStatus from, OrderStatus to) {
            assertThat(OrderStateMachine.canTransition(from, to)).isTrue();
            assertThatCode(() -> OrderStateMachine.validateTransition(from, to)).doesNotThrowAnyException();
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @MethodSource("com.example.commerce.unit.domain.OrderStateMachineTest#rejectedOrderEdges")
        @DisplayName("should_reject_every_other_edge")
        void should_reject_every_other_edge(OrderStatus from, OrderStatus to) {
            assertThat(OrderStateMachine.canTransition(from, to)).isFalse();
            assertThatThrownBy(() -> OrderStateMachine.validateTransition(from, to))
                    .isInstanceOf(InvalidTransitionException.class)
                    .isInstanceOf(InvalidStateException.class)
                    .hasMessage("Invalid order transition from " + from + " to " + to);
        }

        @ParameterizedTest
        @EnumSource(OrderStatus.class)
        @DisplayName("should_expose_exactly_the_listed_edges")
        void should_expose_exactly_the_listed_edges(OrderStatus from) {
            assertThat(OrderStateMachine.allowedTransitions(from)).isEqualTo(ORDER_EDGES.get(from));
        }

        @Test
        @DisplayName("should_allow_cancelling_until_delivery")
        void should_allow_cancelling_until_delivery() {
            assertThat(OrderStateMachine.canTransition(OrderStatus.CONFIRMED, OrderStatus.CANCELLED)).isTrue();
            assertThat(OrderStateMachine.canTransition(OrderStatus.PROCESSING, OrderStatus.CANCELLED)).isTrue();
            assertThat(OrderStateMachine.canTransition(OrderStatus.DELIVERED, OrderStatus.CANCELLED)).isFalse();
        }
    }

    @Nested
    @DisplayName("Payment transitions")
    class PaymentTransitions {

        @ParameterizedTest(name = "{0} -> {1}")
        @MethodSource("com.example.commerce.unit.domain.OrderStateMachineTest#allowedPaymentEdges")
        @DisplayName("should_allow_listed_edges_and_same_status")
        void should_allow_listed_edges_and_same_status(PaymentStatus from, PaymentStatus to) {
            assertThat(OrderStateMachine.canTransition(from, to)).isTrue();
            assertThatCode(() -> OrderStateMachine.validateTransition(from, to)).doesNotThrowAnyException();
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @MethodSource("com.example.commerce.unit.domain.OrderStateMachineTest#rejectedPaymentEdges")
        @DisplayName("should_reject_every_other_edge")
        void should_reject_every_other_edge(PaymentStatus from, PaymentStatus to) {
            assertThat(OrderStateMachine.canTransition(from, to)).isFalse();
            assertThatThrownBy(() -> OrderStateMachine.validateTransition(from, to))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessage("Invalid payment transition from " + from + " to " + to);
        }

        @ParameterizedTest
        @EnumSource(PaymentStatus.class)
        @DisplayName("should_expose_exactly_the_listed_edges")
        void should_expose_exactly_the_listed_edges(PaymentStatus from) {
            assertThat(OrderStateMachine.allowedTransitions(from)).isEqualTo(PAYMENT_EDGES.get(from));
        }

        @ParameterizedTest
        @EnumSource(value = PaymentStatus.class, names = "REFUNDED", mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("should_never_leave_refunded")
        void should_never_leave_refunded(PaymentStatus to) {
            assertThat(OrderStateMachine.canTransition(PaymentStatus.REFUNDED, to)).isFalse();
        }
    }

    @Nested
    @DisplayName("Resolving status updates")
    class Resolve {

        @Test
        @DisplayName("should_derive_confirmed_when_only_payment_becomes_paid")
        void should_derive_confirmed_when_only_payment_becomes_paid() {
            // When
            StatusChange change = OrderStateMachine.resolve(
                    OrderStatus.PENDING, PaymentStatus.PENDING, null, PaymentStatus.PAID);

            // Then
            assertThat(change.orderStatus()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(change.paymentStatus()).isEqualTo(PaymentStatus.PAID);
        }

        @Test
        @DisplayName("should_derive_refunded_order_without_validating_the_order_edge")
        void should_derive_refunded_order_without_validating_the_order_edge() {
            // Given - SHIPPED -> REFUNDED is not an order edge
            StatusChange change = OrderStateMachine.resolve(
                    OrderStatus.SHIPPED, PaymentStatus.PAID, null, PaymentStatus.REFUNDED);

            // Then
            assertThat(change.orderStatus()).isEqualTo(OrderStatus.REFUNDED);
        }

        @Test
        @DisplayName("should_prefer_explicit_order_status_over_derivation")
        void should_prefer_explicit_order_status_over_derivation() {
            StatusChange change = OrderStateMachine.resolve(
                    OrderStatus.PENDING, PaymentStatus.PENDING, OrderStatus.CANCELLED, PaymentStatus.FAILED);

            assertThat(change.orderStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(change.paymentStatus()).isEqualTo(PaymentStatus.FAILED);
        }

        @Test
        @DisplayName("should_not_derive_when_payment_status_is_unchanged")
        void should_not_derive_when_payment_status_is_unchanged() {
            StatusChange change = OrderStateMachine.resolve(
                    OrderStatus.PROCESSING, PaymentStatus.PAID, null, PaymentStatus.PAID);

            assertThat(change.orderStatus()).isEqualTo(OrderStatus.PROCESSING);
        }

        @Test
        @DisplayName("should_reject_invalid_explicit_order_status")
        void should_reject_invalid_explicit_order_status() {
            assertThatThrownBy(() -> OrderStateMachine.resolve(
                    OrderStatus.DELIVERED, PaymentStatus.PAID, OrderStatus.PENDING, null))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessage("Invalid order transition from DELIVERED to PENDING");
        }
    }
}
