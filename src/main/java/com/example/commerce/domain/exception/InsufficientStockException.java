package com.example.commerce.domain.exception;

/**
 * Exception thrown when there is insufficient stock for a product.
 */
public class InsufficientStockException extends DomainException {

    private final String productName;
    private final int availableQuantity;
    private final int requestedQuantity;

    public InsufficientStockException(String productName, int availableQuantity, int requestedQuantity) {
        super(String.format("Insufficient stock for %s. Available: %d, Requested: %d",
                productName, availableQuantity, requestedQuantity));
        this.productName = productName;
        this.availableQuantity = availableQuantity;
        this.requestedQuantity = requestedQuantity;
    }

    public String getProductName() {
        return productName;
    }

    public int getAvailableQuantity() {
        return availableQuantity;
    }

    public int getRequestedQuantity() {
        return requestedQuantity;
    }
}
