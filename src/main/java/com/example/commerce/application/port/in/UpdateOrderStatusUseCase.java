package com.example.commerce.application.port.in;

import com.example.commerce.application.dto.OrderView;
import com.example.commerce.application.dto.UpdateOrderStatusCommand;

public interface UpdateOrderStatusUseCase {

    /**
     * @throws com.example.commerce.domain.exception.InvalidTransitionException if a requested edge is not allowed
     */
    OrderView updateStatus(String orderId, UpdateOrderStatusCommand command);
}
