package com.example.commerce.infrastructure.adapter.in.web;

import com.example.commerce.application.dto.ChartPoint;
import com.example.commerce.application.dto.DashboardStats;
import com.example.commerce.application.dto.RecentOrderView;
import com.example.commerce.application.dto.TopProductView;
import com.example.commerce.application.service.DashboardService;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.Role;
import com.example.commerce.infrastructure.adapter.in.web.dto.ApiEnvelope;
import com.example.commerce.infrastructure.adapter.in.web.support.Blocking;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/dashboard")
@Tag(name = "Dashboard", description = "Back-office aggregates (ADMIN or MANAGER)")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @Operation(summary = "Headline figures with month-over-month trends")
    @GetMapping("/stats")
    public Mono<ApiEnvelope<DashboardStats>> stats(Actor actor) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        return Blocking.call(dashboardService::stats).map(ApiEnvelope::ok);
    }

    @GetMapping("/charts/orders")
    public Mono<ApiEnvelope<List<ChartPoint.Orders>>> ordersChart(Actor actor,
                                                                  @RequestParam(defaultValue = "12") int months) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        return Blocking.call(() -> dashboardService.ordersChart(months)).map(ApiEnvelope::ok);
    }

    @GetMapping("/charts/revenue")
    public Mono<ApiEnvelope<List<ChartPoint.Revenue>>> revenueChart(Actor actor,
                                                                    @RequestParam(defaultValue = "12") int months) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        return Blocking.call(() -> dashboardService.revenueChart(months)).map(ApiEnvelope::ok);
    }

    @GetMapping("/top-products")
    public Mono<ApiEnvelope<List<TopProductView>>> topProducts(Actor actor,
                                                               @RequestParam(defaultValue = "10") int limit) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        return Blocking.call(() -> dashboardService.topProducts(limit)).map(ApiEnvelope::ok);
    }

    @GetMapping("/recent-orders")
    public Mono<ApiEnvelope<List<RecentOrderView>>> recentOrders(Actor actor,
                                                                 @RequestParam(defaultValue = "10") int limit) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        return Blocking.call(() -> dashboardService.recentOrders(limit)).map(ApiEnvelope::ok);
    }
}
