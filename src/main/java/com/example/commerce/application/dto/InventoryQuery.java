package com.example.commerce.application.dto;

public record InventoryQuery(String categoryId, boolean lowStockOnly, String search, PageQuery page) {
}
