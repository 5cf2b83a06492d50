package com.example.commerce.infrastructure.persistence.specification;

import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentMethod;
import com.example.commerce.domain.model.PaymentStatus;
import com.example.commerce.infrastructure.persistence.entity.OrderEntity;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

/**
 * Filters for order listings. A {@code null} result means the filter is not applied.
 */
public final class OrderSpecifications {

    private OrderSpecifications() {
    }

    public static Specification<OrderEntity> matches(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("orderNumber")), pattern),
                cb.like(cb.lower(root.get("customerName")), pattern),
                cb.like(cb.lower(root.get("customerEmail")), pattern));
    }

    public static Specification<OrderEntity> hasOrderStatus(OrderStatus status) {
        return status == null ? null : (root, query, cb) -> cb.equal(root.get("orderStatus"), status);
    }

    public static Specification<OrderEntity> hasPaymentStatus(PaymentStatus status) {
        return status == null ? null : (root, query, cb) -> cb.equal(root.get("paymentStatus"), status);
    }

    public static Specification<OrderEntity> hasPaymentMethod(PaymentMethod method) {
        return method == null ? null : (root, query, cb) -> cb.equal(root.get("paymentMethod"), method);
    }

    public static Specification<OrderEntity> ownedBy(String userId) {
        if (userId == null || userId.isBlank()) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("user").get("id"), userId);
    }
}
