package com.example.commerce.infrastructure.persistence.entity;

import com.example.commerce.domain.exception.InvalidStateException;
import com.example.commerce.domain.model.ProductStatus;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA Entity for catalog products.
 *
 * <p>The stock counter is only changed through {@link #applyStockDelta(int)}, which
 * keeps the out-of-stock status in step with the counter.
 */
@Entity
@Table(name = "products")
public class ProductEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "slug", nullable = false, unique = true, length = 220)
    private String slug;

    @Column(name = "description", length = 4000)
    private String description;

    @Column(name = "sku", unique = true, length = 64)
    private String sku;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "compare_price", precision = 12, scale = 2)
    private BigDecimal comparePrice;

    @Column(name = "cost_price", precision = 12, scale = 2)
    private BigDecimal costPrice;

    @Column(name = "stock", nullable = false)
    private int stock;

    @Column(name = "track_inventory", nullable = false)
    private boolean trackInventory = true;

    @Column(name = "status", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private ProductStatus status = ProductStatus.DRAFT;

    @Column(name = "sales_count", nullable = false)
    private int salesCount;

    @Column(name = "view_count", nullable = false)
    private int viewCount;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id")
    private CategoryEntity category;

    @Column(name = "thumbnail", length = 500)
    private String thumbnail;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Applies a signed stock change and flips the status at the zero boundary.
     *
     * @param delta signed quantity change
     * @throws IllegalStateException if the result would be negative
     */
    public void applyStockDelta(int delta) {
        int newStock;
        try {
            newStock = Math.addExact(stock, delta);
        } catch (ArithmeticException e) {
            throw new InvalidStateException("Stock cannot exceed " + Integer.MAX_VALUE);
        }
        if (newStock < 0) {
            throw new IllegalStateException(
                    "Stock of product " + id + " cannot go negative: " + stock + " + " + delta);
        }
        this.stock = newStock;
        if (newStock == 0) {
            this.status = ProductStatus.OUT_OF_STOCK;
        } else if (status == ProductStatus.OUT_OF_STOCK) {
            this.status = ProductStatus.ACTIVE;
        }
    }

    public boolean hasAvailable(int quantity) {
        return !trackInventory || stock >= quantity;
    }

    public void incrementSales(int quantity) {
        this.salesCount += quantity;
    }

    public void decrementSales(int quantity) {
        this.salesCount = Math.max(0, salesCount - quantity);
    }

    public void incrementViews() {
        this.viewCount++;
    }

    /**
     * Changes the status, stamping the first publication.
     */
    public void changeStatus(ProductStatus newStatus) {
        this.status = newStatus;
        if (newStatus == ProductStatus.ACTIVE && publishedAt == null) {
            this.publishedAt = Instant.now();
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSku() {
        return sku;
    }

    public void setSku(String sku) {
        this.sku = sku;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public BigDecimal getComparePrice() {
        return comparePrice;
    }

    public void setComparePrice(BigDecimal comparePrice) {
        this.comparePrice = comparePrice;
    }

    public BigDecimal getCostPrice() {
        return costPrice;
    }

    public void setCostPrice(BigDecimal costPrice) {
        this.costPrice = costPrice;
    }

    public int getStock() {
        return stock;
    }

    /**
     * Sets the initial stock of a product that has not been persisted yet.
     * Persisted products change stock through the inventory ledger.
     */
    public void setInitialStock(int stock) {
        if (id != null) {
            throw new IllegalStateException("Initial stock can only be set before the product is saved");
        }
        if (stock < 0) {
            throw new IllegalArgumentException("Stock cannot be negative: " + stock);
        }
        this.stock = stock;
    }

    public boolean isTrackInventory() {
        return trackInventory;
    }

    public void setTrackInventory(boolean trackInventory) {
        this.trackInventory = trackInventory;
    }

    public ProductStatus getStatus() {
        return status;
    }

    public int getSalesCount() {
        return salesCount;
    }

    public int getViewCount() {
        return viewCount;
    }

    public CategoryEntity getCategory() {
        return category;
    }

    public void setCategory(CategoryEntity category) {
        this.category = category;
    }

    public String getThumbnail() {
        return thumbnail;
    }

    public void setThumbnail(String thumbnail) {
        this.thumbnail = thumbnail;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public Long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
