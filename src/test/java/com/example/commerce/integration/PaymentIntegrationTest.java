package com.example.commerce.integration;

import com.example.commerce.application.dto.PaymentCommand;
import com.example.commerce.application.dto.PaymentOutcome;
import com.example.commerce.domain.model.NotificationType;
import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentMethod;
import com.example.commerce.domain.model.PaymentStatus;
import com.example.commerce.domain.model.Role;
import com.example.commerce.infrastructure.persistence.PaymentPersistenceService;
import com.example.commerce.infrastructure.persistence.entity.NotificationEntity;
import com.example.commerce.infrastructure.persistence.entity.OrderEntity;
import com.example.commerce.infrastructure.persistence.entity.PaymentEntity;
import com.example.commerce.infrastructure.persistence.entity.ProductEntity;
import com.example.commerce.infrastructure.persistence.entity.UserEntity;
import com.example.commerce.support.IntegrationTestSupport;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Payment processing, gateway initiation and webhook callbacks with the mock gateway.
 */
class PaymentIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private PaymentPersistenceService paymentPersistenceService;

    private UserEntity customer;
    private ProductEntity coffee;
    private String orderId;

    @BeforeEach
    void seed() {
        customer = createCustomer();
        coffee = createProduct("Coffee Beans", "100.00", 10);
        orderId = placeOrder(customer, coffee, 2, "chapa");
    }

    private String paymentRequest(String method) {
        return """
                {
                    "orderId": "%s",
                    "method": "%s",
                    "amount": 255.00,
                    "returnUrl": "https://shop.test/orders/%s"
                }
                """.formatted(orderId, method, orderId);
    }

    private WebTestClient.ResponseSpec post(String uri, UserEntity actor, String body) {
        return webTestClient.post()
                .uri(uri)
                .headers(as(actor))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    private WebTestClient.ResponseSpec webhook(String provider, String body) {
        return webTestClient.post()
                .uri("/api/payments/webhook/{provider}", provider)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    private void updateStatus(UserEntity admin, String body) {
        webTestClient.patch()
                .uri("/api/orders/{id}/status", orderId)
                .headers(as(admin))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk();
    }

        private OrderEntity order() {
        return orderRepository.findById(orderId).orElseThrow();
    }

    @Nested
    @DisplayName("Processing")
    class Processing {

        @Test
        @DisplayName("should_settle_cash_on_delivery_immediately")
        void should_settle_cash_on_delivery_immediately() {
            // When
            post("/api/payments/process", customer, paymentRequest("cash_on_delivery"))
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.data.payment.status").isEqualTo("PAID")
                    .jsonPath("$.data.payment.transactionId").value(tx -> assertThat((String) tx).startsWith("COD-"));

            // Then
            OrderEntity order = order();
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
            assertThat(order.getOrderStatus()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(order.getPaidAt()).isNotNull();
            assertThat(notificationRepository.findAll())
                    .extracting(NotificationEntity::getType)
                    .contains(NotificationType.PAYMENT_RECEIVED);
        }

        @Test
        @DisplayName("should_initiate_and_verify_through_gateway")
        void should_initiate_and_verify_through_gateway() {
            // When
            post("/api/payments/process", customer, paymentRequest("chapa"))
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.message").isEqualTo("Payment processed successfully")
                    .jsonPath("$.data.payment.method").isEqualTo("CHAPA")
                    .jsonPath("$.data.payment.transactionId").value(tx -> assertThat((String) tx).startsWith("MOCK-"));

            // Then
            List<PaymentEntity> payments = paymentRepository.findByOrder_IdOrderByCreatedAtDesc(orderId);
            assertThat(payments).singleElement().satisfies(payment -> {
                assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PAID);
                assertThat(payment.getAmount()).isEqualByComparingTo("255.00");
                assertThat(payment.getGatewayResponse()).contains(payment.getTransactionId());
                assertThat(payment.getProcessedAt()).isNotNull();
            });
            assertThat(order().getOrderStatus()).isEqualTo(OrderStatus.CONFIRMED);
        }

        @Test
        @DisplayName("should_refuse_paying_twice")
        void should_refuse_paying_twice() {
            post("/api/payments/process", customer, paymentRequest("cash_on_delivery")).expectStatus().isOk();

            post("/api/payments/process", customer, paymentRequest("chapa"))
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Order already paid");

            assertThat(paymentRepository.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should_refuse_paying_a_refunded_order")
        void should_refuse_paying_a_refunded_order() {
            // Given
            UserEntity admin = createUser(Role.ADMIN);
            updateStatus(admin, "{\"paymentStatus\": \"PAID\"}");
            updateStatus(admin, "{\"paymentStatus\": \"REFUNDED\", \"orderStatus\": \"CONFIRMED\"}");

            // When
            post("/api/payments/process", customer, paymentRequest("cash_on_delivery"))
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Cannot pay for an order with payment status REFUNDED");

            // Then
            assertThat(order().getPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
            assertThat(paymentRepository.count()).isZero();
        }

        @Test
        @DisplayName("should_accept_a_retry_after_failed_payment")
        void should_accept_a_retry_after_failed_payment() {
            // Given
            updateStatus(createUser(Role.ADMIN), "{\"paymentStatus\": \"FAILED\"}");

            // When
            post("/api/payments/process", customer, paymentRequest("cash_on_delivery"))
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.payment.status").isEqualTo("PAID");

            // Then
            assertThat(order().getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
            assertThat(order().getOrderStatus()).isEqualTo(OrderStatus.CONFIRMED);
        }

        @Test
        @DisplayName("should_keep_a_late_gateway_capture_without_settling_again")
        void should_keep_a_late_gateway_capture_without_settling_again() {
            // Given - the order was settled while a gateway call was still running
            post("/api/payments/process", customer, paymentRequest("cash_on_delivery")).expectStatus().isOk();
            PaymentCommand lateAttempt = new PaymentCommand(
                    orderId, PaymentMethod.CHAPA, new BigDecimal("255.00"), null, null);

            // When
            PaymentOutcome outcome = paymentPersistenceService.recordSettlement(
                    lateAttempt, true, "MOCK-late-capture", "{\"transactionId\":\"MOCK-late-capture\"}");

            // Then
            assertThat(outcome.success()).isFalse();
            assertThat(outcome.message()).isEqualTo("Order already paid");
            assertThat(paymentRepository.findByOrder_IdOrderByCreatedAtDesc(orderId))
                    .hasSize(2)
                    .filteredOn(PaymentEntity::isPaid)
                    .singleElement()
                    .extracting(PaymentEntity::getMethod)
                    .isEqualTo(PaymentMethod.CASH_ON_DELIVERY);
            PaymentEntity late = paymentRepository.findFirstByTransactionId("MOCK-late-capture").orElseThrow();
            assertThat(late.getStatus()).isEqualTo(PaymentStatus.FAILED);
            assertThat(late.getFailureReason()).isEqualTo("Order already paid");
            assertThat(late.getGatewayResponse()).contains("MOCK-late-capture");
            assertThat(order().getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        }

        @Test
        @DisplayName("should_refuse_paying_a_cancelled_order")
        void should_refuse_paying_a_cancelled_order() {
            webTestClient.post()
                    .uri("/api/orders/{id}/cancel", orderId)
                    .headers(as(customer))
                    .exchange()
                    .expectStatus().isOk();

            post("/api/payments/process", customer, paymentRequest("chapa"))
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Cannot pay for an order in status CANCELLED");
        }

        @Test
        @DisplayName("should_forbid_paying_another_customers_order")
        void should_forbid_paying_another_customers_order() {
            post("/api/payments/process", createCustomer(), paymentRequest("chapa"))
                    .expectStatus().isForbidden();

            assertThat(paymentRepository.count()).isZero();
        }

        @Test
        @DisplayName("should_reject_non_positive_amount")
        void should_reject_non_positive_amount() {
            String body = """
                    { "orderId": "%s", "method": "chapa", "amount": 0 }
                    """.formatted(orderId);

            post("/api/payments/process", customer, body)
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.errors.amount").isEqualTo("Amount must be positive");
        }

        @Test
        @DisplayName("should_list_payment_methods")
        void should_list_payment_methods() {
            webTestClient.get()
                    .uri("/api/payments/methods")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.length()").isEqualTo(5)
                    .jsonPath("$.data[0].method").isEqualTo("CHAPA");
        }
    }

    @Nested
    @DisplayName("Initiation and webhook")
    class Webhooks {

        private String initiate() {
            byte[] body = post("/api/payments/initiate", customer, paymentRequest("chapa"))
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.status").isEqualTo("PENDING")
                    .jsonPath("$.data.redirectUrl").exists()
                    .returnResult()
                    .getResponseBody();
            return JsonPath.read(new String(body, StandardCharsets.UTF_8), "$.data.transactionId");
        }

        @Test
        @DisplayName("should_settle_order_on_verified_callback")
        void should_settle_order_on_verified_callback() {
            // Given
            String transactionId = initiate();
            assertThat(order().getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);

            // When
            webhook("chapa", "{\"transactionId\": \"" + transactionId + "\", \"status\": \"success\"}")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.processed").isEqualTo(true)
                    .jsonPath("$.data.status").isEqualTo("PAID")
                    .jsonPath("$.message").isEqualTo("Payment verified");

            // Then
            assertThat(order().getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
            assertThat(order().getOrderStatus()).isEqualTo(OrderStatus.CONFIRMED);
            PaymentEntity payment = paymentRepository.findFirstByTransactionId(transactionId).orElseThrow();
            assertThat(payment.isPaid()).isTrue();
            assertThat(payment.getGatewayResponse()).contains("success");
        }

        @Test
        @DisplayName("should_acknowledge_duplicate_callback_without_changes")
        void should_acknowledge_duplicate_callback_without_changes() {
            // Given
            String transactionId = initiate();
            webhook("chapa", "{\"tx_ref\": \"" + transactionId + "\"}").expectStatus().isOk();
            long notifications = notificationRepository.count();

            // When
            webhook("chapa", "{\"tx_ref\": \"" + transactionId + "\"}")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.processed").isEqualTo(false)
                    .jsonPath("$.message").isEqualTo("Already processed");

            // Then
            assertThat(notificationRepository.count()).isEqualTo(notifications);
        }

        @Test
        @DisplayName("should_set_aside_a_second_capture_once_the_order_is_paid")
        void should_set_aside_a_second_capture_once_the_order_is_paid() {
            // Given - two checkout tabs both reached the gateway
            String first = initiate();
            String second = initiate();
            webhook("chapa", "{\"transactionId\": \"" + first + "\"}").expectStatus().isOk();

            // When
            webhook("chapa", "{\"transactionId\": \"" + second + "\"}")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.processed").isEqualTo(true)
                    .jsonPath("$.data.status").isEqualTo("FAILED")
                    .jsonPath("$.message").isEqualTo("Order already paid");

            // Then
            assertThat(paymentRepository.findFirstByTransactionId(first).orElseThrow().isPaid()).isTrue();
            PaymentEntity setAside = paymentRepository.findFirstByTransactionId(second).orElseThrow();
            assertThat(setAside.isPaid()).isFalse();
            assertThat(setAside.getFailureReason()).isEqualTo("Order already paid");

            webhook("chapa", "{\"transactionId\": \"" + second + "\"}")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.processed").isEqualTo(false);
        }

        @Test
        @DisplayName("should_reject_unknown_provider")
        void should_reject_unknown_provider() {
            webhook("paypal", "{\"transactionId\": \"x\"}")
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Unknown provider");
        }

        @Test
        @DisplayName("should_reject_callback_without_reference")
        void should_reject_callback_without_reference() {
            webhook("telebirr", "{\"status\": \"success\"}")
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Missing transactionId");
        }

        @Test
        @DisplayName("should_report_unknown_transaction_as_processed")
        void should_report_unknown_transaction_as_processed() {
            webhook("santim_pay", "{\"reference\": \"MOCK-0-unknown\"}")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.processed").isEqualTo(false);
        }

        @Test
        @DisplayName("should_verify_payment_by_id")
        void should_verify_payment_by_id() {
            // Given
            String transactionId = initiate();
            String paymentId = paymentRepository.findFirstByTransactionId(transactionId).orElseThrow().getId();

            // When & Then - pending first
            post("/api/payments/" + paymentId + "/verify", customer, "{}")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.verified").isEqualTo(false)
                    .jsonPath("$.data.status").isEqualTo("PENDING");

            webhook("chapa", "{\"transactionId\": \"" + transactionId + "\"}").expectStatus().isOk();

            post("/api/payments/" + paymentId + "/verify", customer, "{}")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.verified").isEqualTo(true)
                    .jsonPath("$.data.transactionId").isEqualTo(transactionId);

            webTestClient.get()
                    .uri("/api/payments/{id}", paymentId)
                    .headers(as(createCustomer()))
                    .exchange()
                    .expectStatus().isForbidden();
        }
    }
}
