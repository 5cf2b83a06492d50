package com.example.commerce.integration;

import com.example.commerce.domain.model.MovementType;
import com.example.commerce.domain.model.NotificationType;
import com.example.commerce.domain.model.ProductStatus;
import com.example.commerce.domain.model.Role;
import com.example.commerce.infrastructure.persistence.entity.InventoryMovementEntity;
import com.example.commerce.infrastructure.persistence.entity.NotificationEntity;
import com.example.commerce.infrastructure.persistence.entity.ProductEntity;
import com.example.commerce.infrastructure.persistence.entity.UserEntity;
import com.example.commerce.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Manual stock adjustments and the inventory ledger.
 */
class InventoryIntegrationTest extends IntegrationTestSupport {

    private UserEntity manager;
    private ProductEntity coffee;

    @BeforeEach
    void seed() {
        manager = createUser(Role.MANAGER);
        coffee = createProduct("Coffee Beans", "100.00", 8);
    }

    private WebTestClient.ResponseSpec adjust(UserEntity actor, String productId, String body) {
        return webTestClient.patch()
                .uri("/api/inventory/{id}/stock", productId)
                .headers(as(actor))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    @Test
    @DisplayName("should_increase_stock_and_record_restock")
    void should_increase_stock_and_record_restock() {
        // When
        adjust(manager, coffee.getId(), """
                { "quantity": 5, "operation": "increase", "reason": "Supplier delivery", "type": "RESTOCK" }
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.previousStock").isEqualTo(8)
                .jsonPath("$.data.newStock").isEqualTo(13)
                .jsonPath("$.data.delta").isEqualTo(5);

        // Then
        List<InventoryMovementEntity> movements = movementRepository.findByProduct_Id(coffee.getId());
        assertThat(movements).singleElement().satisfies(movement -> {
            assertThat(movement.getType()).isEqualTo(MovementType.RESTOCK);
            assertThat(movement.getQuantityDelta()).isEqualTo(5);
            assertThat(movement.getReason()).isEqualTo("Supplier delivery");
            assertThat(movement.getUserId()).isEqualTo(manager.getId());
        });
    }

    @Test
    @DisplayName("should_floor_decrease_at_zero_and_mark_out_of_stock")
    void should_floor_decrease_at_zero_and_mark_out_of_stock() {
        // When
        adjust(manager, coffee.getId(), """
                { "quantity": 20, "operation": "decrease", "reason": "Damaged" }
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.newStock").isEqualTo(0)
                .jsonPath("$.data.delta").isEqualTo(-8)
                .jsonPath("$.data.status").isEqualTo("OUT_OF_STOCK");

        // Then
        assertThat(reload(coffee).getStatus()).isEqualTo(ProductStatus.OUT_OF_STOCK);
        assertThat(movementRepository.findByProduct_Id(coffee.getId()))
                .extracting(InventoryMovementEntity::getType)
                .containsExactly(MovementType.ADJUSTMENT);
        assertThat(notificationRepository.findAll())
                .extracting(NotificationEntity::getType)
                .contains(NotificationType.PRODUCT_OUT_OF_STOCK);
    }

    @Test
    @DisplayName("should_set_stock_and_reactivate")
    void should_set_stock_and_reactivate() {
        // Given
        adjust(manager, coffee.getId(), "{ \"quantity\": 0, \"operation\": \"set\" }").expectStatus().isOk();

        // When
        adjust(manager, coffee.getId(), "{ \"quantity\": 40, \"operation\": \"set\" }")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.delta").isEqualTo(40);

        // Then
        ProductEntity product = reload(coffee);
        assertThat(product.getStock()).isEqualTo(40);
        assertThat(product.getStatus()).isEqualTo(ProductStatus.ACTIVE);
        assertThat(movementRepository.findByProduct_Id(coffee.getId())).hasSize(2);
    }

    @Test
    @DisplayName("should_reject_untracked_products")
    void should_reject_untracked_products() {
        ProductEntity ebook = createProduct("Brewing Guide", "20.00", 0, p -> p.setTrackInventory(false));

        adjust(manager, ebook.getId(), "{ \"quantity\": 5, \"operation\": \"increase\" }")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Product does not track inventory");

        assertThat(movementRepository.count()).isZero();
    }

    @Test
    @DisplayName("should_reject_sale_as_manual_type")
    void should_reject_sale_as_manual_type() {
        adjust(manager, coffee.getId(), "{ \"quantity\": 1, \"operation\": \"decrease\", \"type\": \"SALE\" }")
                .expectStatus().isBadRequest();

        assertThat(reload(coffee).getStock()).isEqualTo(8);
    }

    @Test
    @DisplayName("should_reject_increase_beyond_the_stock_counter")
    void should_reject_increase_beyond_the_stock_counter() {
        adjust(manager, coffee.getId(), "{ \"quantity\": 2147483647, \"operation\": \"increase\" }")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Stock cannot exceed 2147483647");

        assertThat(reload(coffee).getStock()).isEqualTo(8);
        assertThat(movementRepository.findByProduct_Id(coffee.getId())).isEmpty();
    }

    @Test
    @DisplayName("should_reject_negative_quantity")
    void should_reject_negative_quantity() {
        adjust(manager, coffee.getId(), "{ \"quantity\": -1, \"operation\": \"set\" }")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errors.quantity").isEqualTo("Quantity cannot be negative");
    }

    @Test
    @DisplayName("should_forbid_customers")
    void should_forbid_customers() {
        adjust(createCustomer(), coffee.getId(), "{ \"quantity\": 5, \"operation\": \"increase\" }")
                .expectStatus().isForbidden();

        assertThat(reload(coffee).getStock()).isEqualTo(8);
    }

    @Test
    @DisplayName("should_list_low_stock_and_history")
    void should_list_low_stock_and_history() {
        // Given
        createProduct("Tea Leaves", "40.00", 50);
        adjust(manager, coffee.getId(), "{ \"quantity\": 3, \"operation\": \"decrease\" }").expectStatus().isOk();

        // When & Then
        webTestClient.get()
                .uri("/api/inventory/low-stock")
                .headers(as(manager))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.length()").isEqualTo(1)
                .jsonPath("$.data[0].name").isEqualTo("Coffee Beans")
                .jsonPath("$.data[0].stock").isEqualTo(5)
                .jsonPath("$.data[0].lowStock").isEqualTo(true);

        webTestClient.get()
                .uri("/api/inventory/{id}/history", coffee.getId())
                .headers(as(manager))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.items.length()").isEqualTo(1)
                .jsonPath("$.data.items[0].quantityDelta").isEqualTo(-3)
                .jsonPath("$.data.items[0].type").isEqualTo("ADJUSTMENT");

        webTestClient.get()
                .uri("/api/inventory?lowStockOnly=true")
                .headers(as(manager))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.pagination.total").isEqualTo(1);
    }
}
