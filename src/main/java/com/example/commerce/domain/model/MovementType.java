package com.example.commerce.domain.model;

/**
 * Cause of an inventory ledger entry.
 */
public enum MovementType {
    SALE,
    RETURN,
    RESTOCK,
    ADJUSTMENT;

    /**
     * Types an operator may record through a manual stock adjustment.
     */
    public boolean isManual() {
        return this != SALE;
    }
}
