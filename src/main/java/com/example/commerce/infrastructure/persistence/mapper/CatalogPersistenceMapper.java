package com.example.commerce.infrastructure.persistence.mapper;

import com.example.commerce.application.dto.CategoryView;
import com.example.commerce.application.dto.InventoryItemView;
import com.example.commerce.application.dto.MovementView;
import com.example.commerce.application.dto.ProductView;
import com.example.commerce.application.dto.TopProductView;
import com.example.commerce.infrastructure.persistence.entity.CategoryEntity;
import com.example.commerce.infrastructure.persistence.entity.InventoryMovementEntity;
import com.example.commerce.infrastructure.persistence.entity.ProductEntity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Maps products, categories and ledger entries to read models.
 */
@Component
public class CatalogPersistenceMapper {

    private final int lowStockThreshold;

    public CatalogPersistenceMapper(@Value("${commerce.inventory.low-stock-threshold:10}") int lowStockThreshold) {
        this.lowStockThreshold = lowStockThreshold;
    }

    public ProductView toView(ProductEntity product) {
        CategoryEntity category = product.getCategory();
        return new ProductView(
                product.getId(),
                product.getName(),
                product.getSlug(),
                product.getDescription(),
                product.getSku(),
                product.getPrice(),
                product.getComparePrice(),
                product.getStock(),
                product.isTrackInventory(),
                product.getStatus(),
                product.getSalesCount(),
                product.getViewCount(),
                category != null ? category.getId() : null,
                category != null ? category.getName() : null,
                product.getThumbnail(),
                product.getPublishedAt(),
                product.getCreatedAt()
        );
    }

    public InventoryItemView toInventoryView(ProductEntity product) {
        CategoryEntity category = product.getCategory();
        return new InventoryItemView(
                product.getId(),
                product.getName(),
                product.getSku(),
                product.getThumbnail(),
                category != null ? category.getName() : null,
                product.getPrice(),
                product.getStock(),
                product.getStatus(),
                product.isTrackInventory() && product.getStock() <= lowStockThreshold
        );
    }

    public TopProductView toTopProductView(ProductEntity product) {
        CategoryEntity category = product.getCategory();
        return new TopProductView(
                product.getId(),
                product.getName(),
                product.getThumbnail(),
                product.getPrice(),
                product.getSalesCount(),
                category != null ? category.getName() : null
        );
    }

    public CategoryView toView(CategoryEntity category) {
        return new CategoryView(
                category.getId(),
                category.getName(),
                category.getSlug(),
                category.getDescription(),
                category.getImage(),
                category.getParent() != null ? category.getParent().getId() : null,
                category.isActive(),
                category.getSortOrder()
        );
    }

    public MovementView toView(InventoryMovementEntity movement) {
        return new MovementView(
                movement.getId(),
                movement.getProduct().getId(),
                movement.getQuantityDelta(),
                movement.getType(),
                movement.getReason(),
                movement.getReferenceId(),
                movement.getUserId(),
                movement.getCreatedAt()
        );
    }
}
