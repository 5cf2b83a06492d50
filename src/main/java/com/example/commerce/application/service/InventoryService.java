package com.example.commerce.application.service;

import com.example.commerce.application.dto.InventoryItemView;
import com.example.commerce.application.dto.InventoryQuery;
import com.example.commerce.application.dto.MovementView;
import com.example.commerce.application.dto.PageQuery;
import com.example.commerce.application.dto.PageResult;
import com.example.commerce.application.dto.StockAdjustmentCommand;
import com.example.commerce.application.dto.StockAdjustmentResult;
import com.example.commerce.application.port.in.AdjustStockUseCase;
import com.example.commerce.domain.exception.InvalidStateException;
import com.example.commerce.domain.exception.NotFoundException;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.NotificationType;
import com.example.commerce.domain.model.ProductStatus;
import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.UserStatus;
import com.example.commerce.infrastructure.persistence.entity.ProductEntity;
import com.example.commerce.infrastructure.persistence.mapper.CatalogPersistenceMapper;
import com.example.commerce.infrastructure.persistence.repository.InventoryMovementRepository;
import com.example.commerce.infrastructure.persistence.repository.ProductRepository;
import com.example.commerce.infrastructure.persistence.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static com.example.commerce.infrastructure.persistence.specification.ProductSpecifications.inCategory;
import static com.example.commerce.infrastructure.persistence.specification.ProductSpecifications.nameOrDescriptionContains;
import static com.example.commerce.infrastructure.persistence.specification.ProductSpecifications.stockAtMost;
import static com.example.commerce.infrastructure.persistence.specification.ProductSpecifications.tracksInventory;

/**
 * Manual stock management and inventory reporting.
 */
@Service
public class InventoryService implements AdjustStockUseCase {

    private static final Logger log = LoggerFactory.getLogger(InventoryService.class);

    private final ProductRepository productRepository;
    private final InventoryMovementRepository movementRepository;
    private final UserRepository userRepository;
    private final InventoryLedger inventoryLedger;
    private final NotificationService notificationService;
    private final CatalogPersistenceMapper mapper;
    private final int lowStockThreshold;

    public InventoryService(
            ProductRepository productRepository,
            InventoryMovementRepository movementRepository,
            UserRepository userRepository,
            InventoryLedger inventoryLedger,
            NotificationService notificationService,
            CatalogPersistenceMapper mapper,
            @Value("${commerce.inventory.low-stock-threshold:10}") int lowStockThreshold) {
        this.productRepository = productRepository;
        this.movementRepository = movementRepository;
        this.userRepository = userRepository;
        this.inventoryLedger = inventoryLedger;
        this.notificationService = notificationService;
        this.mapper = mapper;
        this.lowStockThreshold = lowStockThreshold;
    }

    @Override
    @Transactional
    public StockAdjustmentResult adjustStock(StockAdjustmentCommand command, Actor actor) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        ProductEntity product = productRepository.findByIdForUpdate(command.productId())
                .orElseThrow(() -> new NotFoundException("Product", command.productId()));
        if (!product.isTrackInventory()) {
            throw new InvalidStateException("Product does not track inventory");
        }

        int previous = product.getStock();
        int target = command.operation().apply(previous, command.quantity());
        int delta = target - previous;

        inventoryLedger.record(product, delta, command.type(), command.reason(), null, actor.userId());
        log.info("Stock adjusted: product={}, operation={}, {} -> {} (delta {}), by {}",
                product.getId(), command.operation(), previous, target, delta, actor.userId());

        if (delta < 0) {
            alertStaffOnLowStock(product);
        }
        return new StockAdjustmentResult(product.getId(), product.getName(), previous,
                product.getStock(), delta, product.getStatus());
    }

    @Transactional(readOnly = true)
    public PageResult<InventoryItemView> listInventory(InventoryQuery query) {
        Specification<ProductEntity> spec = Specification.where(tracksInventory())
                .and(inCategory(query.categoryId()))
                .and(nameOrDescriptionContains(query.search()))
                .and(query.lowStockOnly() ? stockAtMost(lowStockThreshold) : null);

        Sort sort = Sort.by(Sort.Direction.ASC, "stock").and(Sort.by("name"));
        return PageResult.from(productRepository.findAll(spec, query.page().toPageable(sort)),
                mapper::toInventoryView);
    }

    @Transactional(readOnly = true)
    public List<InventoryItemView> lowStock() {
        return productRepository.findLowStock(lowStockThreshold).stream()
                .map(mapper::toInventoryView)
                .toList();
    }

    @Transactional(readOnly = true)
    public PageResult<MovementView> history(String productId, PageQuery page) {
        if (!productRepository.existsById(productId)) {
            throw new NotFoundException("Product", productId);
        }
        return PageResult.from(
                movementRepository.findByProduct_IdOrderByCreatedAtDesc(productId, page.toPageable(Sort.unsorted())),
                mapper::toView);
    }

    public int lowStockThreshold() {
        return lowStockThreshold;
    }

    private void alertStaffOnLowStock(ProductEntity product) {
        if (product.getStock() > lowStockThreshold) {
            return;
        }
        NotificationType type = product.getStatus() == ProductStatus.OUT_OF_STOCK
                ? NotificationType.PRODUCT_OUT_OF_STOCK
                : NotificationType.PRODUCT_LOW_STOCK;
        String message = product.getName() + " has " + product.getStock() + " unit(s) left.";
        userRepository.findByRoleInAndStatus(List.of(Role.ADMIN, Role.MANAGER), UserStatus.ACTIVE)
                .forEach(user -> notificationService.notify(user.getId(), type, "Inventory alert", message,
                        "/inventory/" + product.getId()));
    }
}
