package com.example.commerce.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CategoryRequest(
        @NotBlank(groups = OnCreate.class, message = "Name is required")
        @Size(min = 2, max = 100, message = "Name must be between 2 and 100 characters")
        String name,

        @Size(max = 1000) String description,
        String image,
        String parentId,
        Boolean active,

        @Min(value = 0, message = "Sort order cannot be negative")
        Integer sortOrder
) {
}
