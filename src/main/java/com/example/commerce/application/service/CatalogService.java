package com.example.commerce.application.service;

import com.example.commerce.application.dto.PageResult;
import com.example.commerce.application.dto.ProductCommand;
import com.example.commerce.application.dto.ProductQuery;
import com.example.commerce.application.dto.ProductView;
import com.example.commerce.domain.exception.DuplicateResourceException;
import com.example.commerce.domain.exception.InvalidStateException;
import com.example.commerce.domain.exception.NotFoundException;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.MovementType;
import com.example.commerce.domain.model.ProductStatus;
import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.Slug;
import com.example.commerce.infrastructure.persistence.entity.CategoryEntity;
import com.example.commerce.infrastructure.persistence.entity.ProductEntity;
import com.example.commerce.infrastructure.persistence.mapper.CatalogPersistenceMapper;
import com.example.commerce.infrastructure.persistence.repository.CategoryRepository;
import com.example.commerce.infrastructure.persistence.repository.OrderItemRepository;
import com.example.commerce.infrastructure.persistence.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Set;

import static com.example.commerce.infrastructure.persistence.specification.ProductSpecifications.hasStatus;
import static com.example.commerce.infrastructure.persistence.specification.ProductSpecifications.inCategory;
import static com.example.commerce.infrastructure.persistence.specification.ProductSpecifications.nameOrDescriptionContains;
import static com.example.commerce.infrastructure.persistence.specification.ProductSpecifications.priceAtLeast;
import static com.example.commerce.infrastructure.persistence.specification.ProductSpecifications.priceAtMost;

/**
 * Product catalog. Stock of a persisted product only changes through the inventory ledger.
 */
@Service
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);
    private static final Set<String> SORTABLE = Set.of("createdAt", "price", "name", "stock", "salesCount");

    private final ProductRepository productRepository;
    private final CategoryRepository categoryRepository;
    private final OrderItemRepository orderItemRepository;
    private final InventoryLedger inventoryLedger;
    private final CatalogPersistenceMapper mapper;

    public CatalogService(
            ProductRepository productRepository,
            CategoryRepository categoryRepository,
            OrderItemRepository orderItemRepository,
            InventoryLedger inventoryLedger,
            CatalogPersistenceMapper mapper) {
        this.productRepository = productRepository;
        this.categoryRepository = categoryRepository;
        this.orderItemRepository = orderItemRepository;
        this.inventoryLedger = inventoryLedger;
        this.mapper = mapper;
    }

    @Transactional(readOnly = true)
    public PageResult<ProductView> listProducts(ProductQuery query) {
        Specification<ProductEntity> spec = Specification.where(nameOrDescriptionContains(query.search()))
                .and(inCategory(query.categoryId()))
                .and(hasStatus(query.status()))
                .and(priceAtLeast(query.minPrice()))
                .and(priceAtMost(query.maxPrice()));
        return PageResult.from(productRepository.findAll(spec, query.page().toPageable(SORTABLE)), mapper::toView);
    }

    /**
     * Loads a product for display and counts the view.
     */
    @Transactional
    public ProductView viewProduct(String productId) {
        ProductEntity product = load(productId);
        product.incrementViews();
        return mapper.toView(product);
    }

    @Transactional
    public ProductView createProduct(ProductCommand command, Actor actor) {
        actor.requireAnyRole(Role.ADMIN, Role.SELLER);
        if (command.sku() != null && productRepository.existsBySku(command.sku())) {
            throw new DuplicateResourceException("sku", "A product with this SKU already exists");
        }

        ProductEntity product = new ProductEntity();
        product.setName(command.name());
        product.setSlug(Slug.unique(command.name(), productRepository::existsBySlug));
        applyAttributes(product, command);
        product.setTrackInventory(command.trackInventory() == null || command.trackInventory());
        product.changeStatus(command.status() != null ? command.status() : ProductStatus.DRAFT);

        int initialStock = command.stock() != null ? command.stock() : 0;
        if (!product.isTrackInventory()) {
            product.setInitialStock(initialStock);
        }
        ProductEntity saved = productRepository.save(product);

        if (product.isTrackInventory() && initialStock > 0) {
            inventoryLedger.record(saved, initialStock, MovementType.RESTOCK, "Initial stock", null, actor.userId());
        }
        log.info("Product {} created by {} with slug {}", saved.getId(), actor.userId(), saved.getSlug());
        return mapper.toView(saved);
    }

    /**
     * Updates the given attributes. Stock is not editable here; use a stock adjustment.
     */
    @Transactional
    public ProductView updateProduct(String productId, ProductCommand command, Actor actor) {
        actor.requireAnyRole(Role.ADMIN, Role.SELLER);
        ProductEntity product = load(productId);

        if (command.name() != null && !command.name().equals(product.getName())) {
            product.setName(command.name());
            product.setSlug(Slug.unique(command.name(), productRepository::existsBySlug));
        }
        if (command.sku() != null && !command.sku().equals(product.getSku())
                && productRepository.existsBySku(command.sku())) {
            throw new DuplicateResourceException("sku", "A product with this SKU already exists");
        }
        applyAttributes(product, command);
        if (command.trackInventory() != null) {
            product.setTrackInventory(command.trackInventory());
        }
        if (command.status() != null) {
            product.changeStatus(command.status());
        }
        if (command.stock() != null && command.stock() != product.getStock()) {
            log.warn("Ignoring stock change on product {}; stock changes go through inventory adjustments", productId);
        }
        return mapper.toView(product);
    }

    @Transactional
    public void deleteProduct(String productId, Actor actor) {
        actor.requireAnyRole(Role.ADMIN);
        ProductEntity product = load(productId);
        if (orderItemRepository.existsByProduct_Id(productId)) {
            throw new InvalidStateException("Product has orders; discontinue it instead");
        }
        productRepository.delete(product);
        log.info("Product {} deleted by {}", productId, actor.userId());
    }

    private void applyAttributes(ProductEntity product, ProductCommand command) {
        if (command.description() != null) product.setDescription(command.description());
        if (command.sku() != null) product.setSku(command.sku());
        if (command.price() != null) product.setPrice(command.price());
        if (command.comparePrice() != null) product.setComparePrice(command.comparePrice());
        if (command.costPrice() != null) product.setCostPrice(command.costPrice());
        if (command.thumbnail() != null) product.setThumbnail(command.thumbnail());
        if (command.categoryId() != null) {
            CategoryEntity category = categoryRepository.findById(command.categoryId())
                    .orElseThrow(() -> new NotFoundException("Category", command.categoryId()));
            product.setCategory(category);
        }
    }

    private ProductEntity load(String productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new NotFoundException("Product", productId));
    }
}
