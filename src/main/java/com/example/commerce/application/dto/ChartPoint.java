package com.example.commerce.application.dto;

import java.math.BigDecimal;

/**
 * Monthly data points labelled with the short month name.
 */
public final class ChartPoint {

    private ChartPoint() {
    }

    public record Orders(String date, long orders) {
    }

    public record Revenue(String date, BigDecimal revenue) {
    }
}
