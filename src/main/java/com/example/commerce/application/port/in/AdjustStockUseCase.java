package com.example.commerce.application.port.in;

import com.example.commerce.application.dto.StockAdjustmentCommand;
import com.example.commerce.application.dto.StockAdjustmentResult;
import com.example.commerce.domain.model.Actor;

public interface AdjustStockUseCase {

    /**
     * Applies an increase, decrease or set to a tracked product and records one ledger entry.
     *
     * @throws com.example.commerce.domain.exception.NotFoundException     if the product is missing
     * @throws com.example.commerce.domain.exception.InvalidStateException if the product does not track inventory
     */
    StockAdjustmentResult adjustStock(StockAdjustmentCommand command, Actor actor);
}
