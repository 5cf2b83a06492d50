package com.example.commerce.infrastructure.adapter.in.web;

import com.example.commerce.application.dto.OrderQuery;
import com.example.commerce.application.dto.OrderView;
import com.example.commerce.application.dto.PageQuery;
import com.example.commerce.application.dto.PageResult;
import com.example.commerce.application.port.in.CancelOrderUseCase;
import com.example.commerce.application.port.in.CreateOrderUseCase;
import com.example.commerce.application.port.in.UpdateOrderStatusUseCase;
import com.example.commerce.application.service.OrderService;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentMethod;
import com.example.commerce.domain.model.PaymentStatus;
import com.example.commerce.domain.model.Role;
import com.example.commerce.infrastructure.adapter.in.web.dto.ApiEnvelope;
import com.example.commerce.infrastructure.adapter.in.web.dto.CreateOrderRequest;
import com.example.commerce.infrastructure.adapter.in.web.dto.UpdateOrderStatusRequest;
import com.example.commerce.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import com.example.commerce.infrastructure.adapter.in.web.support.Blocking;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * REST controller for order operations.
 */
@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders", description = "Order placement, status and cancellation")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final CreateOrderUseCase createOrderUseCase;
    private final UpdateOrderStatusUseCase updateOrderStatusUseCase;
    private final CancelOrderUseCase cancelOrderUseCase;
    private final OrderService orderService;
    private final OrderWebMapper mapper;

    public OrderController(
            CreateOrderUseCase createOrderUseCase,
            UpdateOrderStatusUseCase updateOrderStatusUseCase,
            CancelOrderUseCase cancelOrderUseCase,
            OrderService orderService,
            OrderWebMapper mapper) {
        this.createOrderUseCase = createOrderUseCase;
        this.updateOrderStatusUseCase = updateOrderStatusUseCase;
        this.cancelOrderUseCase = cancelOrderUseCase;
        this.orderService = orderService;
        this.mapper = mapper;
    }

    @Operation(
            summary = "Place an order",
            description = """
                    Places an order for the caller:
                    1. **Stock check** - every tracked product must have enough stock
                    2. **Totals** - tax, shipping and total from the pricing settings
                    3. **Atomic write** - order, items, SALE ledger entries and customer totals in one transaction
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Order placed"),
            @ApiResponse(
                    responseCode = "400",
                    description = "Validation failed or insufficient stock",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "success": false,
                                      "message": "Insufficient stock for Coffee Beans. Available: 1, Requested: 2"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(responseCode = "401", description = "Missing caller identity"),
            @ApiResponse(responseCode = "404", description = "User or product not found")
    })
    @PostMapping
    public Mono<ResponseEntity<ApiEnvelope<OrderView>>> createOrder(
            Actor actor,
            @Valid @RequestBody CreateOrderRequest request) {
        log.info("Received order request from {} with {} item(s)", actor.userId(), request.items().size());

        return Blocking.call(() -> createOrderUseCase.createOrder(mapper.toCommand(actor.userId(), request)))
                .map(order -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(ApiEnvelope.ok(order, "Order created successfully")));
    }

    @Operation(summary = "List orders", description = "Customers only see their own orders")
    @GetMapping
    public Mono<ApiEnvelope<PageResult<OrderView>>> listOrders(
            Actor actor,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) OrderStatus orderStatus,
            @RequestParam(required = false) PaymentStatus paymentStatus,
            @RequestParam(required = false) PaymentMethod paymentMethod,
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder) {
        OrderQuery query = new OrderQuery(search, orderStatus, paymentStatus, paymentMethod, userId,
                PageQuery.of(page, limit, sortBy, sortOrder));
        return Blocking.call(() -> orderService.listOrders(query, actor)).map(ApiEnvelope::ok);
    }

    @Operation(summary = "Get an order with its items")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order found"),
            @ApiResponse(responseCode = "403", description = "Order belongs to another customer"),
            @ApiResponse(responseCode = "404", description = "Order not found")
    })
    @GetMapping("/{orderId}")
    public Mono<ApiEnvelope<OrderView>> getOrder(
            Actor actor,
            @Parameter(description = "Order id", required = true) @PathVariable String orderId) {
        return Blocking.call(() -> orderService.getOrder(orderId, actor)).map(ApiEnvelope::ok);
    }

    @Operation(
            summary = "Update order status",
            description = """
                    Updates order, payment and fulfillment status. Order and payment changes must follow
                    the allowed transitions. A payment change without an explicit order status also
                    moves the order (PAID to CONFIRMED, REFUNDED to REFUNDED, otherwise PENDING).
                    """
    )
    @PatchMapping("/{orderId}/status")
    public Mono<ApiEnvelope<OrderView>> updateStatus(
            Actor actor,
            @PathVariable String orderId,
            @Valid @RequestBody UpdateOrderStatusRequest request) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        return Blocking.call(() -> updateOrderStatusUseCase.updateStatus(orderId, mapper.toCommand(request)))
                .map(order -> ApiEnvelope.ok(order, "Order status updated successfully"));
    }

    @Operation(summary = "Cancel an order", description = "Only PENDING or CONFIRMED orders; restores tracked stock")
    @PostMapping("/{orderId}/cancel")
    public Mono<ApiEnvelope<OrderView>> cancelOrder(Actor actor, @PathVariable String orderId) {
        log.info("Cancel requested for order {} by {}", orderId, actor.userId());
        return Blocking.call(() -> cancelOrderUseCase.cancelOrder(orderId, actor))
                .map(order -> ApiEnvelope.ok(order, "Order cancelled successfully"));
    }
}
