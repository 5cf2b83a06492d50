package com.example.commerce.application.dto;

public record CategoryCommand(
        String name,
        String description,
        String image,
        String parentId,
        Boolean active,
        Integer sortOrder
) {
}
