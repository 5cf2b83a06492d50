package com.example.commerce.infrastructure.persistence;

import com.example.commerce.application.dto.CreateOrderCommand;
import com.example.commerce.application.dto.OrderView;
import com.example.commerce.application.service.InventoryLedger;
import com.example.commerce.application.service.NotificationService;
import com.example.commerce.domain.exception.InsufficientStockException;
import com.example.commerce.domain.exception.InvalidStateException;
import com.example.commerce.domain.exception.NotFoundException;
import com.example.commerce.domain.model.Money;
import com.example.commerce.domain.model.MovementType;
import com.example.commerce.domain.model.NotificationType;
import com.example.commerce.domain.model.OrderNumber;
import com.example.commerce.domain.model.OrderTotals;
import com.example.commerce.domain.model.PricingPolicy;
import com.example.commerce.infrastructure.persistence.entity.OrderEntity;
import com.example.commerce.infrastructure.persistence.entity.OrderItemEntity;
import com.example.commerce.infrastructure.persistence.entity.ProductEntity;
import com.example.commerce.infrastructure.persistence.entity.UserEntity;
import com.example.commerce.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.commerce.infrastructure.persistence.repository.OrderRepository;
import com.example.commerce.infrastructure.persistence.repository.ProductRepository;
import com.example.commerce.infrastructure.persistence.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes a placed order in a single transaction: the order with its lines, the
 * stock deductions with their SALE ledger entries, the customer's aggregates and
 * the confirmation notification. Any failure rolls all of it back.
 */
@Service
public class OrderPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(OrderPersistenceService.class);

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final UserRepository userRepository;
    private final InventoryLedger inventoryLedger;
    private final NotificationService notificationService;
    private final OrderPersistenceMapper mapper;

    public OrderPersistenceService(
            OrderRepository orderRepository,
            ProductRepository productRepository,
            UserRepository userRepository,
            InventoryLedger inventoryLedger,
            NotificationService notificationService,
            OrderPersistenceMapper mapper) {
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
        this.userRepository = userRepository;
        this.inventoryLedger = inventoryLedger;
        this.notificationService = notificationService;
        this.mapper = mapper;
    }

    /**
     * Persists the order. Products are re-read under a row lock, in id order, and
     * their stock re-verified before anything is written.
     *
     * @param command the validated order
     * @param pricing pricing rules in effect
     * @return the persisted order
     */
    @Transactional
    public OrderView placeOrder(CreateOrderCommand command, PricingPolicy pricing) {
        UserEntity customer = userRepository.findById(command.userId())
                .orElseThrow(() -> new NotFoundException("User", command.userId()));

        Map<String, ProductEntity> products = lockProducts(requestedQuantities(command));

        Money subtotal = Money.zero(pricing.shippingCost().getCurrency());
        OrderEntity order = new OrderEntity();
        order.snapshotCustomer(customer);
        order.shipTo(command.shippingAddress(), command.shippingCity(),
                command.shippingCountry(), command.shippingPostal());
        order.setPaymentMethod(command.paymentMethod());
        order.setCustomerNotes(command.customerNotes());

        for (CreateOrderCommand.Line line : command.items()) {
            ProductEntity product = products.get(line.productId());
            Money lineTotal = Money.of(product.getPrice(), subtotal.getCurrency()).multiply(line.quantity());
            subtotal = subtotal.add(lineTotal);
            order.addItem(OrderItemEntity.snapshotOf(product, line.quantity(), lineTotal.getAmount()));
        }

        OrderTotals totals = pricing.totalsFor(subtotal);
        order.applyTotals(totals);
        order.setOrderNumber(OrderNumber.next(orderRepository.count()));
        orderRepository.saveAndFlush(order);

        String reason = "Order " + order.getOrderNumber();
        for (CreateOrderCommand.Line line : command.items()) {
            ProductEntity product = products.get(line.productId());
            if (product.isTrackInventory()) {
                inventoryLedger.record(product, -line.quantity(), MovementType.SALE,
                        reason, order.getId(), customer.getId());
                product.incrementSales(line.quantity());
            }
        }

        customer.recordOrder(totals.total().getAmount());

        notificationService.notify(customer.getId(), NotificationType.ORDER_CREATED,
                "Order placed",
                "Your order " + order.getOrderNumber() + " has been placed. Total: " + totals.total(),
                "/orders/" + order.getId());

        log.info("Order {} persisted: id={}, items={}, total={}",
                order.getOrderNumber(), order.getId(), order.getItems().size(), totals.total());
        return mapper.toView(order);
    }

    /**
     * Sums quantities per product, so a product repeated on several lines is checked once.
     */
    public static Map<String, Integer> requestedQuantities(CreateOrderCommand command) {
        Map<String, Integer> quantities = new LinkedHashMap<>();
        command.items().forEach(line -> quantities.merge(line.productId(), line.quantity(),
                OrderPersistenceService::addQuantities));
        return quantities;
    }

    private static int addQuantities(int left, int right) {
        try {
            return Math.addExact(left, right);
        } catch (ArithmeticException e) {
            throw new InvalidStateException("Requested quantity is too large");
        }
    }

    private Map<String, ProductEntity> lockProducts(Map<String, Integer> quantities) {
        Map<String, ProductEntity> locked = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : new TreeMap<>(quantities).entrySet()) {
            ProductEntity product = productRepository.findByIdForUpdate(entry.getKey())
                    .orElseThrow(() -> new NotFoundException("Product", entry.getKey()));
            if (!product.hasAvailable(entry.getValue())) {
                throw new InsufficientStockException(product.getName(), product.getStock(), entry.getValue());
            }
            locked.put(product.getId(), product);
        }
        return locked;
    }
}
