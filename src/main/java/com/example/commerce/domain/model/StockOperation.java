package com.example.commerce.domain.model;

import com.example.commerce.domain.exception.InvalidStateException;

/**
 * Manual stock adjustment operation.
 */
public enum StockOperation {
    INCREASE {
        @Override
        public int apply(int currentStock, int quantity) {
            try {
                return Math.addExact(currentStock, quantity);
            } catch (ArithmeticException e) {
                throw new InvalidStateException("Stock cannot exceed " + Integer.MAX_VALUE);
            }
        }
    },
    DECREASE {
        @Override
        public int apply(int currentStock, int quantity) {
            return Math.max(0, currentStock - quantity);
        }
    },
    SET {
        @Override
        public int apply(int currentStock, int quantity) {
            return quantity;
        }
    };

    /**
     * Computes the resulting stock level. Never negative for a non-negative quantity.
     *
     * @param currentStock stock before the adjustment
     * @param quantity     the operand, at least zero
     * @return stock after the adjustment
     * @throws InvalidStateException if the result does not fit the stock counter
     */
    public abstract int apply(int currentStock, int quantity);
}
