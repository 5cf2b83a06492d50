package com.example.commerce.infrastructure.persistence.entity;

import com.example.commerce.domain.model.FulfillmentStatus;
import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.OrderTotals;
import com.example.commerce.domain.model.PaymentMethod;
import com.example.commerce.domain.model.PaymentStatus;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA Entity for Order persistence.
 *
 * <p>Customer and shipping fields are snapshots taken when the order is placed.
 * Monetary totals are fixed at creation. Lifecycle timestamps are written at most once.
 */
@Entity
@Table(name = "orders")
public class OrderEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "order_number", nullable = false, unique = true, length = 20)
    private String orderNumber;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private UserEntity user;

    @Column(name = "customer_name", length = 120)
    private String customerName;

    @Column(name = "customer_email", length = 200)
    private String customerEmail;

    @Column(name = "customer_phone", length = 32)
    private String customerPhone;

    @Column(name = "shipping_address", nullable = false, length = 500)
    private String shippingAddress;

    @Column(name = "shipping_city", nullable = false, length = 100)
    private String shippingCity;

    @Column(name = "shipping_country", nullable = false, length = 100)
    private String shippingCountry;

    @Column(name = "shipping_postal", length = 20)
    private String shippingPostal;

    @Column(name = "billing_address", length = 500)
    private String billingAddress;

    @Column(name = "billing_city", length = 100)
    private String billingCity;

    @Column(name = "billing_country", length = 100)
    private String billingCountry;

    @Column(name = "billing_postal", length = 20)
    private String billingPostal;

    @Column(name = "subtotal", nullable = false, precision = 14, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "tax", nullable = false, precision = 14, scale = 2)
    private BigDecimal tax;

    @Column(name = "shipping_cost", nullable = false, precision = 14, scale = 2)
    private BigDecimal shippingCost;

    @Column(name = "discount", nullable = false, precision = 14, scale = 2)
    private BigDecimal discount;

    @Column(name = "total", nullable = false, precision = 14, scale = 2)
    private BigDecimal total;

    @Column(name = "order_status", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private OrderStatus orderStatus = OrderStatus.PENDING;

    @Column(name = "payment_status", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private PaymentStatus paymentStatus = PaymentStatus.PENDING;

    @Column(name = "fulfillment_status", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private FulfillmentStatus fulfillmentStatus = FulfillmentStatus.UNFULFILLED;

    @Column(name = "payment_method", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private PaymentMethod paymentMethod;

    @Column(name = "customer_notes", length = 1000)
    private String customerNotes;

    @Column(name = "internal_notes", length = 1000)
    private String internalNotes;

    @Column(name = "tracking_number", length = 64)
    private String trackingNumber;

    @Column(name = "shipping_carrier", length = 64)
    private String shippingCarrier;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "shipped_at")
    private Instant shippedAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<OrderItemEntity> items = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Snapshots the customer's contact details onto the order.
     */
    public void snapshotCustomer(UserEntity customer) {
        this.user = customer;
        this.customerName = customer.getName();
        this.customerEmail = customer.getEmail();
        this.customerPhone = customer.getPhone();
    }

    /**
     * Sets the shipping destination. Billing copies shipping.
     */
    public void shipTo(String address, String city, String country, String postal) {
        this.shippingAddress = address;
        this.shippingCity = city;
        this.shippingCountry = country;
        this.shippingPostal = postal;
        this.billingAddress = address;
        this.billingCity = city;
        this.billingCountry = country;
        this.billingPostal = postal;
    }

    public void applyTotals(OrderTotals totals) {
        this.subtotal = totals.subtotal().getAmount();
        this.tax = totals.tax().getAmount();
        this.shippingCost = totals.shippingCost().getAmount();
        this.discount = totals.discount().getAmount();
        this.total = totals.total().getAmount();
    }

    /**
     * Moves the order to a status, stamping the matching lifecycle timestamp if absent.
     */
    public void moveTo(OrderStatus status, Instant at) {
        this.orderStatus = status;
        switch (status) {
            case SHIPPED -> {
                if (shippedAt == null) shippedAt = at;
            }
            case DELIVERED -> {
                if (deliveredAt == null) deliveredAt = at;
            }
            case CANCELLED -> {
                if (cancelledAt == null) cancelledAt = at;
            }
            default -> {
            }
        }
    }

    /**
     * Moves the payment to a status, stamping {@code paidAt} on the first PAID.
     */
    public void movePaymentTo(PaymentStatus status, Instant at) {
        this.paymentStatus = status;
        if (status == PaymentStatus.PAID && paidAt == null) {
            paidAt = at;
        }
    }

    public void addItem(OrderItemEntity item) {
        items.add(item);
        item.setOrder(this);
    }

    public boolean isOwnedBy(String userId) {
        return user != null && user.getId().equals(userId);
    }

    public String getId() {
        return id;
    }

    public String getOrderNumber() {
        return orderNumber;
    }

    public void setOrderNumber(String orderNumber) {
        this.orderNumber = orderNumber;
    }

    public UserEntity getUser() {
        return user;
    }

    public String getCustomerName() {
        return customerName;
    }

    public String getCustomerEmail() {
        return customerEmail;
    }

    public String getCustomerPhone() {
        return customerPhone;
    }

    public String getShippingAddress() {
        return shippingAddress;
    }

    public String getShippingCity() {
        return shippingCity;
    }

    public String getShippingCountry() {
        return shippingCountry;
    }

    public String getShippingPostal() {
        return shippingPostal;
    }

    public String getBillingAddress() {
        return billingAddress;
    }

    public String getBillingCity() {
        return billingCity;
    }

    public String getBillingCountry() {
        return billingCountry;
    }

    public String getBillingPostal() {
        return billingPostal;
    }

    public BigDecimal getSubtotal() {
        return subtotal;
    }

    public BigDecimal getTax() {
        return tax;
    }

    public BigDecimal getShippingCost() {
        return shippingCost;
    }

    public BigDecimal getDiscount() {
        return discount;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public OrderStatus getOrderStatus() {
        return orderStatus;
    }

    public PaymentStatus getPaymentStatus() {
        return paymentStatus;
    }

    public FulfillmentStatus getFulfillmentStatus() {
        return fulfillmentStatus;
    }

    public void setFulfillmentStatus(FulfillmentStatus fulfillmentStatus) {
        this.fulfillmentStatus = fulfillmentStatus;
    }

    public PaymentMethod getPaymentMethod() {
        return paymentMethod;
    }

    public void setPaymentMethod(PaymentMethod paymentMethod) {
        this.paymentMethod = paymentMethod;
    }

    public String getCustomerNotes() {
        return customerNotes;
    }

    public void setCustomerNotes(String customerNotes) {
        this.customerNotes = customerNotes;
    }

    public String getInternalNotes() {
        return internalNotes;
    }

    public void setInternalNotes(String internalNotes) {
        this.internalNotes = internalNotes;
    }

    public String getTrackingNumber() {
        return trackingNumber;
    }

    public void setTrackingNumber(String trackingNumber) {
        this.trackingNumber = trackingNumber;
    }

    public String getShippingCarrier() {
        return shippingCarrier;
    }

    public void setShippingCarrier(String shippingCarrier) {
        this.shippingCarrier = shippingCarrier;
    }

    public Instant getPaidAt() {
        return paidAt;
    }

    public Instant getShippedAt() {
        return shippedAt;
    }

    public Instant getDeliveredAt() {
        return deliveredAt;
    }

    public Instant getCancelledAt() {
        return cancelledAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Backdates an order.
     */
    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public List<OrderItemEntity> getItems() {
        return items;
    }
}
