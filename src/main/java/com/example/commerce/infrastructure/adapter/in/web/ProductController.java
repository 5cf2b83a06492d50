package com.example.commerce.infrastructure.adapter.in.web;

import com.example.commerce.application.dto.PageQuery;
import com.example.commerce.application.dto.PageResult;
import com.example.commerce.application.dto.ProductQuery;
import com.example.commerce.application.dto.ProductView;
import com.example.commerce.application.service.CatalogService;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.ProductStatus;
import com.example.commerce.infrastructure.adapter.in.web.dto.ApiEnvelope;
import com.example.commerce.infrastructure.adapter.in.web.dto.OnCreate;
import com.example.commerce.infrastructure.adapter.in.web.dto.ProductRequest;
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

import java.math.BigDecimal;

@RestController
@RequestMapping("/api/products")
@Tag(name = "Products", description = "Product catalog")
public class ProductController {

    private final CatalogService catalogService;
    private final CatalogWebMapper mapper;

    public ProductController(CatalogService catalogService, CatalogWebMapper mapper) {
        this.catalogService = catalogService;
        this.mapper = mapper;
    }

    @Operation(summary = "Search products", description = "Public. sortBy: createdAt, price, name, stock or salesCount")
    @GetMapping
    public Mono<ApiEnvelope<PageResult<ProductView>>> listProducts(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) ProductStatus status,
            @RequestParam(required = false) BigDecimal minPrice,
            @RequestParam(required = false) BigDecimal maxPrice,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder) {
        ProductQuery query = new ProductQuery(search, category, status, minPrice, maxPrice,
                PageQuery.of(page, limit, sortBy, sortOrder));
        return Blocking.call(() -> catalogService.listProducts(query)).map(ApiEnvelope::ok);
    }

    @Operation(summary = "Get a product", description = "Public. Counts a view")
    @GetMapping("/{productId}")
    public Mono<ApiEnvelope<ProductView>> getProduct(@PathVariable String productId) {
        return Blocking.call(() -> catalogService.viewProduct(productId)).map(ApiEnvelope::ok);
    }

    @Operation(summary = "Create a product", description = "ADMIN or SELLER")
    @PostMapping
    public Mono<ResponseEntity<ApiEnvelope<ProductView>>> createProduct(
            Actor actor,
            @Validated({Default.class, OnCreate.class}) @RequestBody ProductRequest request) {
        return Blocking.call(() -> catalogService.createProduct(mapper.toCommand(request), actor))
                .map(product -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(ApiEnvelope.ok(product, "Product created successfully")));
    }

    @Operation(summary = "Update a product", description = "ADMIN or SELLER. Stock changes go through inventory")
    @PutMapping("/{productId}")
    public Mono<ApiEnvelope<ProductView>> updateProduct(
            Actor actor,
            @PathVariable String productId,
            @Valid @RequestBody ProductRequest request) {
        return Blocking.call(() -> catalogService.updateProduct(productId, mapper.toCommand(request), actor))
                .map(product -> ApiEnvelope.ok(product, "Product updated successfully"));
    }

    @Operation(summary = "Delete a product", description = "ADMIN. Refused once the product has been ordered")
    @DeleteMapping("/{productId}")
    public Mono<ApiEnvelope<Void>> deleteProduct(Actor actor, @PathVariable String productId) {
        return Blocking.run(() -> catalogService.deleteProduct(productId, actor))
                .thenReturn(ApiEnvelope.message("Product deleted successfully"));
    }
}
