package com.example.commerce.infrastructure.persistence.entity;

import com.example.commerce.domain.model.PaymentMethod;
import com.example.commerce.domain.model.PaymentStatus;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA Entity for a single payment attempt against an order.
 */
@Entity
@Table(name = "payments", indexes = {
        @Index(name = "idx_payment_transaction", columnList = "transaction_id")
})
public class PaymentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", length = 36)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false)
    private OrderEntity order;

    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(name = "method", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private PaymentMethod method;

    @Column(name = "status", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private PaymentStatus status;

    @Column(name = "transaction_id", length = 100)
    private String transactionId;

    @Column(name = "gateway_response", length = 4000)
    private String gatewayResponse;

    @Column(name = "failure_reason", length = 255)
    private String failureReason;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected PaymentEntity() {
    }

    public static PaymentEntity attempt(OrderEntity order, BigDecimal amount, PaymentMethod method,
                                        PaymentStatus status, String transactionId, String gatewayResponse) {
        PaymentEntity payment = new PaymentEntity();
        payment.order = order;
        payment.amount = amount;
        payment.method = method;
        payment.status = status;
        payment.transactionId = transactionId;
        payment.gatewayResponse = gatewayResponse;
        if (status == PaymentStatus.PAID) {
            payment.processedAt = Instant.now();
        }
        return payment;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Marks the attempt as settled after a successful verification.
     */
    public void markPaid(String gatewayResponse) {
        this.status = PaymentStatus.PAID;
        this.gatewayResponse = gatewayResponse;
        this.processedAt = Instant.now();
    }

    public void markFailed(String gatewayResponse) {
        this.status = PaymentStatus.FAILED;
        this.gatewayResponse = gatewayResponse;
    }

    /**
     * Records an attempt that could not be applied to its order, such as a gateway
     * capture arriving after another payment settled the order. The gateway reference
     * and snapshot stay on the row so the money can be refunded.
     */
    public static PaymentEntity unapplied(OrderEntity order, BigDecimal amount, PaymentMethod method,
                                          String transactionId, String gatewayResponse, String reason) {
        PaymentEntity payment = attempt(order, amount, method, PaymentStatus.FAILED, transactionId, gatewayResponse);
        payment.failureReason = reason;
        return payment;
    }

    public void markUnapplied(String gatewayResponse, String reason) {
        markFailed(gatewayResponse);
        this.failureReason = reason;
    }

    public boolean isPaid() {
        return status == PaymentStatus.PAID;
    }

    public boolean isUnapplied() {
        return failureReason != null;
    }

    public String getId() {
        return id;
    }

    public OrderEntity getOrder() {
        return order;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public PaymentMethod getMethod() {
        return method;
    }

    public PaymentStatus getStatus() {
        return status;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public String getGatewayResponse() {
        return gatewayResponse;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
