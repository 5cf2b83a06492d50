package com.example.commerce.infrastructure.adapter.in.web.mapper;

import com.example.commerce.application.dto.CategoryCommand;
import com.example.commerce.application.dto.CreateUserCommand;
import com.example.commerce.application.dto.ProductCommand;
import com.example.commerce.application.dto.UpdateUserCommand;
import com.example.commerce.infrastructure.adapter.in.web.dto.CategoryRequest;
import com.example.commerce.infrastructure.adapter.in.web.dto.CreateUserRequest;
import com.example.commerce.infrastructure.adapter.in.web.dto.ProductRequest;
import com.example.commerce.infrastructure.adapter.in.web.dto.UpdateUserRequest;
import org.springframework.stereotype.Component;

/**
 * Mapper between catalog and account web DTOs and application commands.
 */
@Component
public class CatalogWebMapper {

    public ProductCommand toCommand(ProductRequest request) {
        return new ProductCommand(
                request.name(),
                request.description(),
                request.sku(),
                request.price(),
                request.comparePrice(),
                request.costPrice(),
                request.stock(),
                request.trackInventory(),
                request.status(),
                request.categoryId(),
                request.thumbnail());
    }

    public CategoryCommand toCommand(CategoryRequest request) {
        return new CategoryCommand(
                request.name(),
                request.description(),
                request.image(),
                request.parentId(),
                request.active(),
                request.sortOrder());
    }

    public CreateUserCommand toCommand(CreateUserRequest request) {
        return new CreateUserCommand(
                request.name(),
                request.email(),
                request.phone(),
                request.role(),
                request.status(),
                request.address(),
                request.city(),
                request.country(),
                request.postalCode());
    }

    public UpdateUserCommand toCommand(UpdateUserRequest request) {
        return new UpdateUserCommand(
                request.name(),
                request.phone(),
                request.address(),
                request.city(),
                request.country(),
                request.postalCode(),
                request.status(),
                request.role());
    }
}
