package com.example.commerce.application.service;

import com.example.commerce.application.dto.ChartPoint;
import com.example.commerce.application.dto.DashboardStats;
import com.example.commerce.application.dto.RecentOrderView;
import com.example.commerce.application.dto.TopProductView;
import com.example.commerce.domain.model.OrderStatus;
import com.example.commerce.domain.model.PaymentStatus;
import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.Trend;
import com.example.commerce.domain.model.UserStatus;
import com.example.commerce.infrastructure.persistence.mapper.CatalogPersistenceMapper;
import com.example.commerce.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.commerce.infrastructure.persistence.repository.OrderRepository;
import com.example.commerce.infrastructure.persistence.repository.ProductRepository;
import com.example.commerce.infrastructure.persistence.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Read-only aggregates for the back-office dashboard.
 *
 * <p>Trends compare the month ending today with the month before it, both anchored on
 * today's day of month. Chart buckets are calendar months in the reporting zone.
 */
@Service
@Transactional(readOnly = true)
public class DashboardService {

    private static final Logger log = LoggerFactory.getLogger(DashboardService.class);
    private static final int MAX_MONTHS = 24;
    private static final int MAX_LIMIT = 50;

    private final OrderRepository orderRepository;
    private final UserRepository userRepository;
    private final ProductRepository productRepository;
    private final OrderPersistenceMapper orderMapper;
    private final CatalogPersistenceMapper catalogMapper;
    private final Clock clock;

    public DashboardService(
            OrderRepository orderRepository,
            UserRepository userRepository,
            ProductRepository productRepository,
            OrderPersistenceMapper orderMapper,
            CatalogPersistenceMapper catalogMapper,
            @Value("${commerce.reporting.zone:UTC}") String reportingZone) {
        this.orderRepository = orderRepository;
        this.userRepository = userRepository;
        this.productRepository = productRepository;
        this.orderMapper = orderMapper;
        this.catalogMapper = catalogMapper;
        this.clock = Clock.system(ZoneId.of(reportingZone));
    }

    public DashboardStats stats() {
        LocalDate today = LocalDate.now(clock);
        Instant lastMonth = startOf(today.minusMonths(1));
        Instant previousMonth = startOf(today.minusMonths(2));

        long totalOrders = orderRepository.count();
        BigDecimal totalRevenue = orderRepository.sumTotalByPaymentStatus(PaymentStatus.PAID);
        long activeUsers = userRepository.countByStatusAndRole(UserStatus.ACTIVE, Role.CUSTOMER);
        long pendingOrders = orderRepository.countByOrderStatus(OrderStatus.PENDING);
        long paidOrders = orderRepository.countByPaymentStatusAndCreatedAtGreaterThanEqual(PaymentStatus.PAID, lastMonth);

        long previousOrders = orderRepository.countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(previousMonth, lastMonth);
        BigDecimal previousRevenue = orderRepository.sumTotalByPaymentStatusBetween(PaymentStatus.PAID, previousMonth, lastMonth);
        long previousUsers = userRepository.countByRoleAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(
                Role.CUSTOMER, previousMonth, lastMonth);

        log.debug("Dashboard stats: orders={}, revenue={}, activeUsers={}, pending={}",
                totalOrders, totalRevenue, activeUsers, pendingOrders);
        return new DashboardStats(
                totalOrders,
                totalRevenue,
                activeUsers,
                pendingOrders,
                Trend.percentChange(paidOrders, previousOrders),
                Trend.percentChange(totalRevenue, previousRevenue),
                Trend.percentChange(activeUsers, previousUsers));
    }

    /**
     * Orders created per calendar month, oldest first, ending with the current month.
     */
    public List<ChartPoint.Orders> ordersChart(int months) {
        List<ChartPoint.Orders> points = new ArrayList<>();
        for (LocalDate month : monthWindow(months)) {
            long count = orderRepository.countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(
                    startOf(month), startOf(month.plusMonths(1)));
            points.add(new ChartPoint.Orders(label(month), count));
        }
        return points;
    }

    /**
     * Revenue of paid orders per calendar month, oldest first.
     */
    public List<ChartPoint.Revenue> revenueChart(int months) {
        List<ChartPoint.Revenue> points = new ArrayList<>();
        for (LocalDate month : monthWindow(months)) {
            BigDecimal revenue = orderRepository.sumTotalByPaymentStatusBetween(
                    PaymentStatus.PAID, startOf(month), startOf(month.plusMonths(1)));
            points.add(new ChartPoint.Revenue(label(month), revenue));
        }
        return points;
    }

    public List<TopProductView> topProducts(int limit) {
        return productRepository.findAllByOrderBySalesCountDesc(PageRequest.of(0, clamp(limit, MAX_LIMIT)))
                .stream()
                .map(catalogMapper::toTopProductView)
                .toList();
    }

    public List<RecentOrderView> recentOrders(int limit) {
        return orderRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, clamp(limit, MAX_LIMIT)))
                .stream()
                .map(orderMapper::toRecentView)
                .toList();
    }

    private List<LocalDate> monthWindow(int months) {
        LocalDate firstOfThisMonth = LocalDate.now(clock).withDayOfMonth(1);
        int count = clamp(months, MAX_MONTHS);
        List<LocalDate> window = new ArrayList<>(count);
        for (int i = count - 1; i >= 0; i--) {
            window.add(firstOfThisMonth.minusMonths(i));
        }
        return window;
    }

    private Instant startOf(LocalDate date) {
        return date.atStartOfDay(clock.getZone()).toInstant();
    }

    private static String label(LocalDate month) {
        return month.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    private static int clamp(int value, int max) {
        return Math.max(1, Math.min(value, max));
    }
}
