package com.example.commerce.infrastructure.persistence.specification;

import com.example.commerce.domain.model.ProductStatus;
import com.example.commerce.infrastructure.persistence.entity.ProductEntity;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Filters for product listings. Each factory returns {@code null} when its filter is
 * absent, which {@link Specification#where} treats as "match all".
 */
public final class ProductSpecifications {

    private ProductSpecifications() {
    }

    public static Specification<ProductEntity> nameOrDescriptionContains(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("name")), pattern),
                cb.like(cb.lower(root.get("description")), pattern),
                cb.like(cb.lower(root.get("sku")), pattern));
    }

    public static Specification<ProductEntity> inCategory(String categoryId) {
        if (categoryId == null || categoryId.isBlank()) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("category").get("id"), categoryId);
    }

    public static Specification<ProductEntity> hasStatus(ProductStatus status) {
        if (status == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    public static Specification<ProductEntity> priceAtLeast(BigDecimal minPrice) {
        if (minPrice == null) {
            return null;
        }
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("price"), minPrice);
    }

    public static Specification<ProductEntity> priceAtMost(BigDecimal maxPrice) {
        if (maxPrice == null) {
            return null;
        }
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("price"), maxPrice);
    }

    public static Specification<ProductEntity> tracksInventory() {
        return (root, query, cb) -> cb.isTrue(root.get("trackInventory"));
    }

    public static Specification<ProductEntity> stockAtMost(Integer threshold) {
        if (threshold == null) {
            return null;
        }
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("stock"), threshold);
    }
}
