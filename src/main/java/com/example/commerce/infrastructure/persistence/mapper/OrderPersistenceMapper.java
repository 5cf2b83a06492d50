package com.example.commerce.infrastructure.persistence.mapper;

import com.example.commerce.application.dto.OrderView;
import com.example.commerce.application.dto.RecentOrderView;
import com.example.commerce.infrastructure.persistence.entity.OrderEntity;
import com.example.commerce.infrastructure.persistence.entity.OrderItemEntity;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps persisted orders to read models. Must be called inside a transaction so
 * the lazy item collection can be loaded.
 */
@Component
public class OrderPersistenceMapper {

    public OrderView toView(OrderEntity entity) {
        List<OrderView.Item> items = entity.getItems().stream()
                .map(this::toItemView)
                .toList();

        return new OrderView(
                entity.getId(),
                entity.getOrderNumber(),
                entity.getUser().getId(),
                entity.getCustomerName(),
                entity.getCustomerEmail(),
                entity.getCustomerPhone(),
                entity.getShippingAddress(),
                entity.getShippingCity(),
                entity.getShippingCountry(),
                entity.getShippingPostal(),
                entity.getSubtotal(),
                entity.getTax(),
                entity.getShippingCost(),
                entity.getDiscount(),
                entity.getTotal(),
                entity.getOrderStatus(),
                entity.getPaymentStatus(),
                entity.getFulfillmentStatus(),
                entity.getPaymentMethod(),
                entity.getCustomerNotes(),
                entity.getInternalNotes(),
                entity.getTrackingNumber(),
                entity.getShippingCarrier(),
                entity.getPaidAt(),
                entity.getShippedAt(),
                entity.getDeliveredAt(),
                entity.getCancelledAt(),
                entity.getCreatedAt(),
                items
        );
    }

    public RecentOrderView toRecentView(OrderEntity entity) {
        return new RecentOrderView(
                entity.getId(),
                entity.getOrderNumber(),
                entity.getCustomerName(),
                entity.getTotal(),
                entity.getOrderStatus(),
                entity.getPaymentStatus(),
                entity.getCreatedAt()
        );
    }

    private OrderView.Item toItemView(OrderItemEntity item) {
        return new OrderView.Item(
                item.getId(),
                item.getProduct().getId(),
                item.getProductName(),
                item.getProductSku(),
                item.getProductImage(),
                item.getPrice(),
                item.getQuantity(),
                item.getSubtotal()
        );
    }
}
