package com.example.commerce.infrastructure.adapter.in.web.mapper;

import com.example.commerce.application.dto.CreateOrderCommand;
import com.example.commerce.application.dto.PaymentCommand;
import com.example.commerce.application.dto.StockAdjustmentCommand;
import com.example.commerce.application.dto.UpdateOrderStatusCommand;
import com.example.commerce.infrastructure.adapter.in.web.dto.CreateOrderRequest;
import com.example.commerce.infrastructure.adapter.in.web.dto.PaymentRequest;
import com.example.commerce.infrastructure.adapter.in.web.dto.StockUpdateRequest;
import com.example.commerce.infrastructure.adapter.in.web.dto.UpdateOrderStatusRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper between order, payment and stock web DTOs and application commands.
 */
@Component
public class OrderWebMapper {

    public CreateOrderCommand toCommand(String userId, CreateOrderRequest request) {
        List<CreateOrderCommand.Line> items = request.items().stream()
                .map(item -> new CreateOrderCommand.Line(item.productId(), item.quantity()))
                .toList();

        return new CreateOrderCommand(
                userId,
                items,
                request.shippingAddress(),
                request.shippingCity(),
                request.shippingCountry(),
                request.shippingPostal(),
                request.paymentMethod(),
                request.customerNotes());
    }

    public UpdateOrderStatusCommand toCommand(UpdateOrderStatusRequest request) {
        return new UpdateOrderStatusCommand(
                request.orderStatus(),
                request.paymentStatus(),
                request.fulfillmentStatus(),
                request.trackingNumber(),
                request.shippingCarrier(),
                request.internalNotes());
    }

    public StockAdjustmentCommand toCommand(String productId, StockUpdateRequest request) {
        return new StockAdjustmentCommand(
                productId,
                request.quantity(),
                request.operation(),
                request.reason(),
                request.type());
    }

    public PaymentCommand toCommand(PaymentRequest request) {
        return new PaymentCommand(
                request.orderId(),
                request.method(),
                request.amount(),
                request.returnUrl(),
                request.cancelUrl());
    }
}
