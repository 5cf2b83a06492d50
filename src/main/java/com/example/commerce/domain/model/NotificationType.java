package com.example.commerce.domain.model;

public enum NotificationType {
    ORDER_CREATED,
    ORDER_UPDATED,
    ORDER_SHIPPED,
    ORDER_DELIVERED,
    PAYMENT_RECEIVED,
    PAYMENT_FAILED,
    PRODUCT_LOW_STOCK,
    PRODUCT_OUT_OF_STOCK,
    USER_REGISTERED,
    SYSTEM_ALERT
}
