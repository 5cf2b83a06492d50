package com.example.commerce.application.service;

import com.example.commerce.application.dto.CreateOrderCommand;
import com.example.commerce.application.dto.OrderQuery;
import com.example.commerce.application.dto.OrderView;
import com.example.commerce.application.dto.PageResult;
import com.example.commerce.application.dto.UpdateOrderStatusCommand;
import com.example.commerce.application.port.in.CancelOrderUseCase;
import com.example.commerce.application.port.in.CreateOrderUseCase;
import com.example.commerce.application.port.in.UpdateOrderStatusUseCase;
import com.example.commerce.domain.exception.InsufficientStockException;
import com.example.commerce.domain.exception.InvalidStateException;
import com.example.commerce.domain.exception.NotFoundException;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.MovementType;
import com.example.commerce.domain.model.NotificationType;
import com.example.commerce.domain.model.OrderStateMachine;
import com.example.commerce.domain.model.OrderStateMachine.StatusChange;
import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentStatus;
import com.example.commerce.domain.model.PricingPolicy;
import com.example.commerce.infrastructure.persistence.OrderPersistenceService;
import com.example.commerce.infrastructure.persistence.entity.OrderEntity;
import com.example.commerce.infrastructure.persistence.entity.OrderItemEntity;
import com.example.commerce.infrastructure.persistence.entity.ProductEntity;
import com.example.commerce.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.commerce.infrastructure.persistence.repository.OrderRepository;
import com.example.commerce.infrastructure.persistence.repository.ProductRepository;
import com.example.commerce.infrastructure.persistence.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.example.commerce.infrastructure.persistence.specification.OrderSpecifications.hasOrderStatus;
import static com.example.commerce.infrastructure.persistence.specification.OrderSpecifications.hasPaymentMethod;
import static com.example.commerce.infrastructure.persistence.specification.OrderSpecifications.hasPaymentStatus;
import static com.example.commerce.infrastructure.persistence.specification.OrderSpecifications.matches;
import static com.example.commerce.infrastructure.persistence.specification.OrderSpecifications.ownedBy;

/**
 * Application service for the order lifecycle: placement, status changes,
 * cancellation and queries.
 */
@Service
public class OrderService implements CreateOrderUseCase, CancelOrderUseCase, UpdateOrderStatusUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);
    private static final int ORDER_NUMBER_ATTEMPTS = 5;
    private static final Set<String> SORTABLE = Set.of("createdAt", "total", "orderNumber", "orderStatus");

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final UserRepository userRepository;
    private final OrderPersistenceService persistenceService;
    private final InventoryLedger inventoryLedger;
    private final SettingsService settingsService;
    private final NotificationService notificationService;
    private final OrderPersistenceMapper mapper;

    public OrderService(
            OrderRepository orderRepository,
            ProductRepository productRepository,
            UserRepository userRepository,
            OrderPersistenceService persistenceService,
            InventoryLedger inventoryLedger,
            SettingsService settingsService,
            NotificationService notificationService,
            OrderPersistenceMapper mapper) {
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
        this.userRepository = userRepository;
        this.persistenceService = persistenceService;
        this.inventoryLedger = inventoryLedger;
        this.settingsService = settingsService;
        this.notificationService = notificationService;
        this.mapper = mapper;
    }

    @Override
    public OrderView createOrder(CreateOrderCommand command) {
        log.info("Creating order for user {} with {} line(s)", command.userId(), command.items().size());

        if (!userRepository.existsById(command.userId())) {
            throw new NotFoundException("User", command.userId());
        }
        precheckStock(command);

        PricingPolicy pricing = settingsService.pricingPolicy();
        OrderView order = placeWithFreshNumber(command, pricing);

        log.info("Order created: {} ({}), total={}", order.orderNumber(), order.id(), order.total());
        return order;
    }

    /**
     * Order numbers come from the order count, so two placements committing at the same
     * time can draw the same number. The loser's transaction rolls back on the unique
     * index, reported as a constraint or concurrent-update failure depending on the
     * database, and is replayed; the replay counts the winner's order.
     */
    private OrderView placeWithFreshNumber(CreateOrderCommand command, PricingPolicy pricing) {
        for (int attempt = 1; ; attempt++) {
            try {
                return persistenceService.placeOrder(command, pricing);
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                if (attempt >= ORDER_NUMBER_ATTEMPTS) {
                    throw e;
                }
                log.warn("Order for user {} collided with a concurrent placement, retrying (attempt {} of {}): {}",
                        command.userId(), attempt + 1, ORDER_NUMBER_ATTEMPTS, e.getMessage());
            }
        }
    }

    /**
     * Fails fast before the write transaction. The placement re-checks under lock.
     */
    private void precheckStock(CreateOrderCommand command) {
        Map<String, Integer> quantities = OrderPersistenceService.requestedQuantities(command);
        Map<String, ProductEntity> products = productRepository.findAllById(quantities.keySet()).stream()
                .collect(Collectors.toMap(ProductEntity::getId, Function.identity()));

        quantities.forEach((productId, quantity) -> {
            ProductEntity product = products.get(productId);
            if (product == null) {
                throw new NotFoundException("Product", productId);
            }
            if (!product.hasAvailable(quantity)) {
                throw new InsufficientStockException(product.getName(), product.getStock(), quantity);
            }
        });
    }

    @Override
    @Transactional
    public OrderView updateStatus(String orderId, UpdateOrderStatusCommand command) {
        OrderEntity order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new NotFoundException("Order", orderId));

        OrderStatus previousOrder = order.getOrderStatus();
        PaymentStatus previousPayment = order.getPaymentStatus();
        StatusChange change = OrderStateMachine.resolve(previousOrder, previousPayment,
                command.orderStatus(), command.paymentStatus());

        Instant now = Instant.now();
        if (change.orderStatus() != previousOrder) {
            order.moveTo(change.orderStatus(), now);
        }
        if (change.paymentStatus() != previousPayment) {
            order.movePaymentTo(change.paymentStatus(), now);
        }
        if (command.fulfillmentStatus() != null) {
            order.setFulfillmentStatus(command.fulfillmentStatus());
        }
        if (command.trackingNumber() != null) {
            order.setTrackingNumber(command.trackingNumber());
        }
        if (command.shippingCarrier() != null) {
            order.setShippingCarrier(command.shippingCarrier());
        }
        if (command.internalNotes() != null) {
            order.setInternalNotes(command.internalNotes());
        }

        if (change.orderStatus() != previousOrder || change.paymentStatus() != previousPayment) {
            log.info("Order {} status: order {} -> {}, payment {} -> {}", order.getOrderNumber(),
                    previousOrder, change.orderStatus(), previousPayment, change.paymentStatus());
            notifyStatusChange(order, previousOrder);
        }
        return mapper.toView(order);
    }

    @Override
    @Transactional
    public OrderView cancelOrder(String orderId, Actor actor) {
        // A concurrent cancel blocks on the row lock and then finds the order CANCELLED.
        OrderEntity order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new NotFoundException("Order", orderId));
        actor.requireOwnerOrElevated(order.getUser().getId());

        if (!order.getOrderStatus().isCancellable()) {
            throw new InvalidStateException("Cannot cancel order in current status");
        }

        Map<String, Integer> quantities = new TreeMap<>();
        for (OrderItemEntity item : order.getItems()) {
            quantities.merge(item.getProduct().getId(), item.getQuantity(), Integer::sum);
        }
        quantities.forEach((productId, quantity) -> {
            ProductEntity product = productRepository.findByIdForUpdate(productId)
                    .orElseThrow(() -> new NotFoundException("Product", productId));
            if (product.isTrackInventory()) {
                inventoryLedger.record(product, quantity, MovementType.RETURN,
                        "Order cancelled", order.getId(), actor.userId());
                product.decrementSales(quantity);
            }
        });

        order.moveTo(OrderStatus.CANCELLED, Instant.now());
        log.info("Order {} cancelled by {} ({})", order.getOrderNumber(), actor.userId(), actor.role());

        notificationService.notify(order.getUser().getId(), NotificationType.ORDER_UPDATED,
                "Order cancelled", "Your order " + order.getOrderNumber() + " has been cancelled.",
                "/orders/" + order.getId());
        return mapper.toView(order);
    }

    @Transactional(readOnly = true)
    public OrderView getOrder(String orderId, Actor actor) {
        OrderEntity order = orderRepository.findWithItemsById(orderId)
                .orElseThrow(() -> new NotFoundException("Order", orderId));
        actor.requireOwnerOrElevated(order.getUser().getId());
        return mapper.toView(order);
    }

    /**
     * Lists orders matching the query. Customers only ever see their own orders.
     */
    @Transactional(readOnly = true)
    public PageResult<OrderView> listOrders(OrderQuery query, Actor actor) {
        String userId = actor.isElevated() ? query.userId() : actor.userId();

        Specification<OrderEntity> spec = Specification.where(matches(query.search()))
                .and(hasOrderStatus(query.orderStatus()))
                .and(hasPaymentStatus(query.paymentStatus()))
                .and(hasPaymentMethod(query.paymentMethod()))
                .and(ownedBy(userId));

        return PageResult.from(orderRepository.findAll(spec, query.page().toPageable(SORTABLE)), mapper::toView);
    }

    private void notifyStatusChange(OrderEntity order, OrderStatus previousOrder) {
        NotificationType type = NotificationType.ORDER_UPDATED;
        String message = "Your order " + order.getOrderNumber() + " is now " + order.getOrderStatus() + ".";
        if (order.getOrderStatus() != previousOrder && order.getOrderStatus() == OrderStatus.SHIPPED) {
            type = NotificationType.ORDER_SHIPPED;
            message = "Your order " + order.getOrderNumber() + " has shipped.";
        } else if (order.getOrderStatus() != previousOrder && order.getOrderStatus() == OrderStatus.DELIVERED) {
            type = NotificationType.ORDER_DELIVERED;
            message = "Your order " + order.getOrderNumber() + " has been delivered.";
        }
        notificationService.notify(order.getUser().getId(), type, "Order update", message, "/orders/" + order.getId());
    }
}
