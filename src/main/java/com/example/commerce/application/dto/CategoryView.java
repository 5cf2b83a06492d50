package com.example.commerce.application.dto;

public record CategoryView(
        String id,
        String name,
        String slug,
        String description,
        String image,
        String parentId,
        boolean active,
        int sortOrder
) {
}
