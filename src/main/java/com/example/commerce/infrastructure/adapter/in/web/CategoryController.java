package com.example.commerce.infrastructure.adapter.in.web;

import com.example.commerce.application.dto.CategoryView;
import com.example.commerce.application.service.CategoryService;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.infrastructure.adapter.in.web.dto.ApiEnvelope;
import com.example.commerce.infrastructure.adapter.in.web.dto.CategoryRequest;
import com.example.commerce.infrastructure.adapter.in.web.dto.OnCreate;
import com.example.commerce.infrastructure.adapter.in.web.mapper.CatalogWebMapper;
import com.example.commerce.infrastructure.adapter.in.web.support.Blocking;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.groups.Default;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/categories")
@Tag(name = "Categories", description = "Product categories")
public class CategoryController {

    private final CategoryService categoryService;
    private final CatalogWebMapper mapper;

    public CategoryController(CategoryService categoryService, CatalogWebMapper mapper) {
        this.categoryService = categoryService;
        this.mapper = mapper;
    }

    @Operation(summary = "List categories", description = "Public. Active only unless includeInactive")
    @GetMapping
    public Mono<ApiEnvelope<List<CategoryView>>> listCategories(
            @RequestParam(defaultValue = "false") boolean includeInactive) {
        return Blocking.call(() -> categoryService.listCategories(includeInactive)).map(ApiEnvelope::ok);
    }

    @GetMapping("/{categoryId}")
    public Mono<ApiEnvelope<CategoryView>> getCategory(@PathVariable String categoryId) {
        return Blocking.call(() -> categoryService.getCategory(categoryId)).map(ApiEnvelope::ok);
    }

    @Operation(summary = "Create a category", description = "ADMIN")
    @PostMapping
    public Mono<ResponseEntity<ApiEnvelope<CategoryView>>> createCategory(
            Actor actor,
            @Validated({Default.class, OnCreate.class}) @RequestBody CategoryRequest request) {
        return Blocking.call(() -> categoryService.createCategory(mapper.toCommand(request), actor))
                .map(category -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(ApiEnvelope.ok(category, "Category created successfully")));
    }

    @Operation(summary = "Update a category", description = "ADMIN")
    @PutMapping("/{categoryId}")
    public Mono<ApiEnvelope<CategoryView>> updateCategory(
            Actor actor,
            @PathVariable String categoryId,
            @Valid @RequestBody CategoryRequest request) {
        return Blocking.call(() -> categoryService.updateCategory(categoryId, mapper.toCommand(request), actor))
                .map(category -> ApiEnvelope.ok(category, "Category updated successfully"));
    }

    @Operation(summary = "Delete a category", description = "ADMIN. Refused while products or subcategories use it")
    @DeleteMapping("/{categoryId}")
    public Mono<ApiEnvelope<Void>> deleteCategory(Actor actor, @PathVariable String categoryId) {
        return Blocking.run(() -> categoryService.deleteCategory(categoryId, actor))
                .thenReturn(ApiEnvelope.message("Category deleted successfully"));
    }
}
