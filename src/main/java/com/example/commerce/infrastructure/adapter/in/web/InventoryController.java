package com.example.commerce.infrastructure.adapter.in.web;

import com.example.commerce.application.dto.InventoryItemView;
import com.example.commerce.application.dto.InventoryQuery;
import com.example.commerce.application.dto.MovementView;
import com.example.commerce.application.dto.PageQuery;
import com.example.commerce.application.dto.PageResult;
import com.example.commerce.application.dto.StockAdjustmentResult;
import com.example.commerce.application.port.in.AdjustStockUseCase;
import com.example.commerce.application.service.InventoryService;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.Role;
import com.example.commerce.infrastructure.adapter.in.web.dto.ApiEnvelope;
import com.example.commerce.infrastructure.adapter.in.web.dto.StockUpdateRequest;
import com.example.commerce.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import com.example.commerce.infrastructure.adapter.in.web.support.Blocking;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/inventory")
@Tag(name = "Inventory", description = "Stock levels and the inventory ledger")
public class InventoryController {

    private final AdjustStockUseCase adjustStockUseCase;
    private final InventoryService inventoryService;
    private final OrderWebMapper mapper;

    public InventoryController(AdjustStockUseCase adjustStockUseCase, InventoryService inventoryService,
                               OrderWebMapper mapper) {
        this.adjustStockUseCase = adjustStockUseCase;
        this.inventoryService = inventoryService;
        this.mapper = mapper;
    }

    @Operation(summary = "List tracked products ordered by stock")
    @GetMapping
    public Mono<ApiEnvelope<PageResult<InventoryItemView>>> listInventory(
            Actor actor,
            @RequestParam(required = false) String category,
            @RequestParam(defaultValue = "false") boolean lowStockOnly,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        InventoryQuery query = new InventoryQuery(category, lowStockOnly, search, PageQuery.of(page, limit));
        return Blocking.call(() -> inventoryService.listInventory(query)).map(ApiEnvelope::ok);
    }

    @Operation(summary = "Tracked products at or below the low-stock threshold")
    @GetMapping("/low-stock")
    public Mono<ApiEnvelope<List<InventoryItemView>>> lowStock(Actor actor) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        return Blocking.call(inventoryService::lowStock).map(ApiEnvelope::ok);
    }

    @Operation(summary = "Ledger entries of a product, newest first")
    @GetMapping("/{productId}/history")
    public Mono<ApiEnvelope<PageResult<MovementView>>> history(
            Actor actor,
            @PathVariable String productId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        return Blocking.call(() -> inventoryService.history(productId, PageQuery.of(page, limit)))
                .map(ApiEnvelope::ok);
    }

    @Operation(
            summary = "Adjust stock",
            description = "increase adds, decrease subtracts and stops at zero, set replaces the level. "
                    + "The ledger records the change actually applied."
    )
    @PatchMapping("/{productId}/stock")
    public Mono<ApiEnvelope<StockAdjustmentResult>> adjustStock(
            Actor actor,
            @PathVariable String productId,
            @Valid @RequestBody StockUpdateRequest request) {
        return Blocking.call(() -> adjustStockUseCase.adjustStock(mapper.toCommand(productId, request), actor))
                .map(result -> ApiEnvelope.ok(result, "Stock updated successfully"));
    }
}
