package com.example.commerce.infrastructure.persistence.entity;

import com.example.commerce.domain.model.MovementType;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Append-only inventory ledger entry. Rows are never updated or deleted.
 */
@Entity
@Table(name = "inventory_movements", indexes = {
        @Index(name = "idx_movement_product_created", columnList = "product_id, created_at")
})
public class InventoryMovementEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", length = 36)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false, updatable = false)
    private ProductEntity product;

    @Column(name = "quantity_delta", nullable = false, updatable = false)
    private int quantityDelta;

    @Column(name = "type", nullable = false, updatable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private MovementType type;

    @Column(name = "reason", updatable = false, length = 500)
    private String reason;

    @Column(name = "reference_id", updatable = false, length = 64)
    private String referenceId;

    @Column(name = "user_id", updatable = false, length = 36)
    private String userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected InventoryMovementEntity() {
    }

    public static InventoryMovementEntity record(ProductEntity product, int quantityDelta, MovementType type,
                                                 String reason, String referenceId, String userId) {
        InventoryMovementEntity movement = new InventoryMovementEntity();
        movement.product = product;
        movement.quantityDelta = quantityDelta;
        movement.type = type;
        movement.reason = reason;
        movement.referenceId = referenceId;
        movement.userId = userId;
        return movement;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public ProductEntity getProduct() {
        return product;
    }

    public int getQuantityDelta() {
        return quantityDelta;
    }

    public MovementType getType() {
        return type;
    }

    public String getReason() {
        return reason;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
