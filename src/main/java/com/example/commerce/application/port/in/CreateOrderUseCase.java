package com.example.commerce.application.port.in;

import com.example.commerce.application.dto.CreateOrderCommand;
import com.example.commerce.application.dto.OrderView;

/**
 * Inbound port for placing orders.
 */
public interface CreateOrderUseCase {

    /**
     * Places an order atomically: the order, its lines, the stock deductions, the
     * ledger entries and the customer's aggregates are written together or not at all.
     *
     * @param command the order to place
     * @return the persisted order
     * @throws com.example.commerce.domain.exception.NotFoundException          if the user or a product is missing
     * @throws com.example.commerce.domain.exception.InsufficientStockException if a tracked product lacks stock
     */
    OrderView createOrder(CreateOrderCommand command);
}
