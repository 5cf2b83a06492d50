package com.example.commerce.domain.model;

/**
 * Shipment completeness. Tracked on the order but not guarded by transition rules.
 */
public enum FulfillmentStatus {
    UNFULFILLED,
    PARTIALLY_FULFILLED,
    FULFILLED
}
