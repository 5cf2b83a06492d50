package com.example.commerce.infrastructure.persistence.entity;

import jakarta.persistence.*;

import java.math.BigDecimal;

/**
 * JPA Entity for an order line. Product details are copied at order time.
 */
@Entity
@Table(name = "order_items")
public class OrderItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", length = 36)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false)
    private OrderEntity order;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private ProductEntity product;

    @Column(name = "product_name", nullable = false, length = 200)
    private String productName;

    @Column(name = "product_sku", length = 64)
    private String productSku;

    @Column(name = "product_image", length = 500)
    private String productImage;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "subtotal", nullable = false, precision = 14, scale = 2)
    private BigDecimal subtotal;

    protected OrderItemEntity() {
    }

    /**
     * Creates a line from the product's current details.
     */
    public static OrderItemEntity snapshotOf(ProductEntity product, int quantity, BigDecimal subtotal) {
        OrderItemEntity item = new OrderItemEntity();
        item.product = product;
        item.productName = product.getName();
        item.productSku = product.getSku();
        item.productImage = product.getThumbnail();
        item.price = product.getPrice();
        item.quantity = quantity;
        item.subtotal = subtotal;
        return item;
    }

    public String getId() {
        return id;
    }

    public OrderEntity getOrder() {
        return order;
    }

    void setOrder(OrderEntity order) {
        this.order = order;
    }

    public ProductEntity getProduct() {
        return product;
    }

    public String getProductName() {
        return productName;
    }

    public String getProductSku() {
        return productSku;
    }

    public String getProductImage() {
        return productImage;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public int getQuantity() {
        return quantity;
    }

    public BigDecimal getSubtotal() {
        return subtotal;
    }
}
