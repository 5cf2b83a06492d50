package com.example.commerce.application.service;

import com.example.commerce.domain.model.MovementType;
import com.example.commerce.infrastructure.persistence.entity.InventoryMovementEntity;
import com.example.commerce.infrastructure.persistence.entity.ProductEntity;
import com.example.commerce.infrastructure.persistence.repository.InventoryMovementRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends signed stock deltas to the ledger and keeps the product's counter in step.
 *
 * <p>Joins the caller's transaction; it never commits on its own. Callers pass a
 * product they have loaded with a row lock.
 */
@Component
public class InventoryLedger {

    private static final Logger log = LoggerFactory.getLogger(InventoryLedger.class);

    private final InventoryMovementRepository movementRepository;

    public InventoryLedger(InventoryMovementRepository movementRepository) {
        this.movementRepository = movementRepository;
    }

    /**
     * Applies {@code delta} to the product's stock and records one movement.
     *
     * @param product     a locked, managed product
     * @param delta       signed quantity change
     * @param type        cause of the change
     * @param reason      free-text reason, may be {@code null}
     * @param referenceId related entity such as an order id, may be {@code null}
     * @param actorId     user performing the change
     * @return the recorded movement
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public InventoryMovementEntity record(ProductEntity product, int delta, MovementType type,
                                          String reason, String referenceId, String actorId) {
        int before = product.getStock();
        product.applyStockDelta(delta);

        InventoryMovementEntity movement = movementRepository.save(
                InventoryMovementEntity.record(product, delta, type, reason, referenceId, actorId));

        log.debug("[LEDGER] product={}, type={}, delta={}, stock {} -> {}, status={}",
                product.getId(), type, delta, before, product.getStock(), product.getStatus());
        return movement;
    }
}
