package com.example.commerce.application.port.in;

import com.example.commerce.application.dto.OrderView;
import com.example.commerce.domain.model.Actor;

/**
 * Inbound port for cancelling orders.
 */
public interface CancelOrderUseCase {

    /**
     * Cancels a PENDING or CONFIRMED order and returns its stock in one transaction.
     *
     * @throws com.example.commerce.domain.exception.ForbiddenException    if a customer cancels another user's order
     * @throws com.example.commerce.domain.exception.InvalidStateException if the order can no longer be cancelled
     */
    OrderView cancelOrder(String orderId, Actor actor);
}
