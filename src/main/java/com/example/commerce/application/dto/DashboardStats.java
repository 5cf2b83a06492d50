package com.example.commerce.application.dto;

import java.math.BigDecimal;

/**
 * Headline figures with month-over-month trends in percent, one decimal place.
 */
public record DashboardStats(
        long totalOrders,
        BigDecimal totalRevenue,
        long activeUsers,
        long pendingOrders,
        double ordersTrend,
        double revenueTrend,
        double usersTrend
) {
}
