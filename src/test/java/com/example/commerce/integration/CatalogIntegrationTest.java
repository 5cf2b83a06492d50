package com.example.commerce.integration;

import com.example.commerce.domain.model.MovementType;
import com.example.commerce.domain.model.Role;
import com.example.commerce.infrastructure.persistence.entity.CategoryEntity;
import com.example.commerce.infrastructure.persistence.entity.ProductEntity;
import com.example.commerce.infrastructure.persistence.entity.UserEntity;
import com.example.commerce.support.IntegrationTestSupport;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Products and categories through the public and back-office endpoints.
 */
class CatalogIntegrationTest extends IntegrationTestSupport {

    private UserEntity admin;
    private CategoryEntity beverages;

    @BeforeEach
    void seed() {
        admin = createUser(Role.ADMIN);
        beverages = createCategory("Beverages");
    }

    private WebTestClient.ResponseSpec postProduct(UserEntity actor, String body) {
        return webTestClient.post()
                .uri("/api/products")
                .headers(as(actor))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    @Nested
    @DisplayName("Products")
    class Products {

        @Test
        @DisplayName("should_create_product_with_slug_and_initial_stock_entry")
        void should_create_product_with_slug_and_initial_stock_entry() {
            // When
            byte[] body = postProduct(admin, """
                    {
                        "name": "Yirgacheffe Coffee",
                        "sku": "YRG-250",
                        "price": 320.00,
                        "stock": 12,
                        "status": "ACTIVE",
                        "categoryId": "%s"
                    }
                    """.formatted(beverages.getId()))
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Product created successfully")
                    .jsonPath("$.data.slug").isEqualTo("yirgacheffe-coffee")
                    .jsonPath("$.data.stock").isEqualTo(12)
                    .jsonPath("$.data.categoryName").isEqualTo("Beverages")
                    .jsonPath("$.data.publishedAt").exists()
                    .returnResult()
                    .getResponseBody();
            String productId = JsonPath.read(new String(body, StandardCharsets.UTF_8), "$.data.id");

            // Then
            assertThat(movementRepository.findByProduct_Id(productId)).singleElement().satisfies(movement -> {
                assertThat(movement.getType()).isEqualTo(MovementType.RESTOCK);
                assertThat(movement.getQuantityDelta()).isEqualTo(12);
                assertThat(movement.getReason()).isEqualTo("Initial stock");
            });
        }

        @Test
        @DisplayName("should_suffix_slug_when_name_is_taken")
        void should_suffix_slug_when_name_is_taken() {
            postProduct(admin, "{ \"name\": \"Green Tea\", \"price\": 50 }").expectStatus().isCreated();

            postProduct(createUser(Role.SELLER), "{ \"name\": \"Green Tea\", \"price\": 55 }")
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.data.slug").isEqualTo("green-tea-2")
                    .jsonPath("$.data.status").isEqualTo("DRAFT");
        }

        @Test
        @DisplayName("should_reject_duplicate_sku")
        void should_reject_duplicate_sku() {
            postProduct(admin, "{ \"name\": \"Green Tea\", \"sku\": \"TEA-1\", \"price\": 50 }").expectStatus().isCreated();

            postProduct(admin, "{ \"name\": \"Black Tea\", \"sku\": \"TEA-1\", \"price\": 50 }")
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.errors.sku").isEqualTo("A product with this SKU already exists");
        }

        @Test
        @DisplayName("should_require_name_and_price_on_create")
        void should_require_name_and_price_on_create() {
            postProduct(admin, "{ \"description\": \"Nameless\" }")
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.errors.name").isEqualTo("Name is required")
                    .jsonPath("$.errors.price").isEqualTo("Price is required");
        }

        @Test
        @DisplayName("should_forbid_customers_from_creating_products")
        void should_forbid_customers_from_creating_products() {
            postProduct(createCustomer(), "{ \"name\": \"Green Tea\", \"price\": 50 }")
                    .expectStatus().isForbidden();

            assertThat(productRepository.count()).isZero();
        }

        @Test
        @DisplayName("should_count_views_on_public_get")
        void should_count_views_on_public_get() {
            ProductEntity coffee = createProduct("Coffee Beans", "100.00", 5);

            webTestClient.get().uri("/api/products/{id}", coffee.getId()).exchange().expectStatus().isOk();
            webTestClient.get().uri("/api/products/{id}", coffee.getId())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.viewCount").isEqualTo(2);
        }

        @Test
        @DisplayName("should_keep_stock_when_updating_product")
        void should_keep_stock_when_updating_product() {
            // Given
            ProductEntity coffee = createProduct("Coffee Beans", "100.00", 5);

            // When
            webTestClient.put()
                    .uri("/api/products/{id}", coffee.getId())
                    .headers(as(admin))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{ \"name\": \"Sidamo Coffee\", \"price\": 120.00, \"stock\": 99 }")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.slug").isEqualTo("sidamo-coffee")
                    .jsonPath("$.data.price").isEqualTo(120.0)
                    .jsonPath("$.data.stock").isEqualTo(5);

            // Then
            assertThat(reload(coffee).getStock()).isEqualTo(5);
            assertThat(movementRepository.count()).isZero();
        }

        @Test
        @DisplayName("should_search_and_filter_products")
        void should_search_and_filter_products() {
            createProduct("Coffee Beans", "100.00", 5, p -> p.setCategory(beverages));
            createProduct("Coffee Mug", "300.00", 5);
            createProduct("Tea Leaves", "40.00", 5, p -> p.setCategory(beverages));

            webTestClient.get()
                    .uri("/api/products?search=coffee&maxPrice=150")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.items.length()").isEqualTo(1)
                    .jsonPath("$.data.items[0].name").isEqualTo("Coffee Beans");

            webTestClient.get()
                    .uri("/api/products?category={id}&sortBy=price&sortOrder=asc", beverages.getId())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.pagination.total").isEqualTo(2)
                    .jsonPath("$.data.items[0].name").isEqualTo("Tea Leaves");
        }

        @Test
        @DisplayName("should_refuse_deleting_ordered_product")
        void should_refuse_deleting_ordered_product() {
            // Given
            ProductEntity coffee = createProduct("Coffee Beans", "100.00", 5);
            placeOrder(createCustomer(), coffee, 1, "cash_on_delivery");

            // When & Then
            webTestClient.delete()
                    .uri("/api/products/{id}", coffee.getId())
                    .headers(as(admin))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Product has orders; discontinue it instead");

            assertThat(productRepository.existsById(coffee.getId())).isTrue();
        }

        @Test
        @DisplayName("should_delete_unordered_product_as_admin_only")
        void should_delete_unordered_product_as_admin_only() {
            ProductEntity mug = createProduct("Coffee Mug", "300.00", 0, p -> p.setTrackInventory(false));

            webTestClient.delete()
                    .uri("/api/products/{id}", mug.getId())
                    .headers(as(createUser(Role.SELLER)))
                    .exchange()
                    .expectStatus().isForbidden();

            webTestClient.delete()
                    .uri("/api/products/{id}", mug.getId())
                    .headers(as(admin))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true);

            assertThat(productRepository.existsById(mug.getId())).isFalse();
        }
    }

    @Nested
    @DisplayName("Categories")
    class Categories {

        @Test
        @DisplayName("should_create_child_category")
        void should_create_child_category() {
            webTestClient.post()
                    .uri("/api/categories")
                    .headers(as(admin))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{ \"name\": \"Hot Drinks\", \"parentId\": \"%s\" }".formatted(beverages.getId()))
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.data.slug").isEqualTo("hot-drinks")
                    .jsonPath("$.data.parentId").isEqualTo(beverages.getId())
                    .jsonPath("$.data.active").isEqualTo(true);
        }

        @Test
        @DisplayName("should_list_only_active_categories_by_default")
        void should_list_only_active_categories_by_default() {
            CategoryEntity archived = createCategory("Archived");
            archived.setActive(false);
            categoryRepository.save(archived);

            webTestClient.get()
                    .uri("/api/categories")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.length()").isEqualTo(1)
                    .jsonPath("$.data[0].name").isEqualTo("Beverages");

            webTestClient.get()
                    .uri("/api/categories?includeInactive=true")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.length()").isEqualTo(2);
        }

        @Test
        @DisplayName("should_refuse_deleting_category_in_use")
        void should_refuse_deleting_category_in_use() {
            createProduct("Tea Leaves", "40.00", 5, p -> p.setCategory(beverages));

            webTestClient.delete()
                    .uri("/api/categories/{id}", beverages.getId())
                    .headers(as(admin))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Cannot delete category with products");
        }

        @Test
        @DisplayName("should_refuse_being_own_parent")
        void should_refuse_being_own_parent() {
            webTestClient.put()
                    .uri("/api/categories/{id}", beverages.getId())
                    .headers(as(admin))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{ \"parentId\": \"%s\" }".formatted(beverages.getId()))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("A category cannot be its own parent");
        }

        @Test
        @DisplayName("should_return_404_for_unknown_category")
        void should_return_404_for_unknown_category() {
            webTestClient.get()
                    .uri("/api/categories/{id}", "missing")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false);
        }
    }
}
