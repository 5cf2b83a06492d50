package com.example.commerce.integration;

import com.example.commerce.domain.model.ProductStatus;
import com.example.commerce.domain.model.Role;
import com.example.commerce.infrastructure.adapter.in.web.support.ActorArgumentResolver;
import com.example.commerce.infrastructure.persistence.entity.OrderEntity;
import com.example.commerce.infrastructure.persistence.entity.ProductEntity;
import com.example.commerce.infrastructure.persistence.entity.UserEntity;
import com.example.commerce.support.PostgresTestContainerSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Customers racing for the last units of a product. Checkout must never oversell.
 */
class ConcurrentCheckoutIntegrationTest extends PostgresTestContainerSupport {

    private static final int BUYERS = 8;
    private static final int STOCK = 3;

    @Test
    @DisplayName("should_sell_exactly_the_available_stock_under_contention")
    void should_sell_exactly_the_available_stock_under_contention() throws Exception {
        // Given
        ProductEntity product = new ProductEntity();
        product.setName("Limited Roast");
        product.setSlug("limited-roast");
        product.setPrice(new BigDecimal("100.00"));
        product.setInitialStock(STOCK);
        product.changeStatus(ProductStatus.ACTIVE);
        String productId = productRepository.save(product).getId();

        List<UserEntity> buyers = new ArrayList<>();
        for (int i = 0; i < BUYERS; i++) {
            UserEntity buyer = new UserEntity();
            buyer.setName("Buyer " + i);
            buyer.setEmail("buyer" + i + "@example.com");
            buyer.setRole(Role.CUSTOMER);
            buyers.add(userRepository.save(buyer));
        }

        // When
        ExecutorService executor = Executors.newFixedThreadPool(BUYERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> statuses = new ArrayList<>();
        for (UserEntity buyer : buyers) {
            statuses.add(executor.submit(() -> {
                start.await();
                return webTestClient.post()
                        .uri("/api/orders")
                        .header(ActorArgumentResolver.USER_ID_HEADER, buyer.getId())
                        .header(ActorArgumentResolver.USER_ROLE_HEADER, "CUSTOMER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue("""
                                {
                                    "items": [ { "productId": "%s", "quantity": 1 } ],
                                    "shippingAddress": "Bole Road 12",
                                    "shippingCity": "Addis Ababa",
                                    "shippingCountry": "Ethiopia",
                                    "paymentMethod": "cash_on_delivery"
                                }
                                """.formatted(productId))
                        .exchange()
                        .returnResult(String.class)
                        .getStatus()
                        .value();
            }));
        }
        start.countDown();

        List<Integer> results = new ArrayList<>();
        for (Future<Integer> status : statuses) {
            results.add(status.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();

        // Then
        assertThat(results).filteredOn(status -> status == 201).hasSize(STOCK);
        assertThat(results).filteredOn(status -> status == 400).hasSize(BUYERS - STOCK);

        ProductEntity sold = productRepository.findById(productId).orElseThrow();
        assertThat(sold.getStock()).isZero();
        assertThat(sold.getSalesCount()).isEqualTo(STOCK);
        assertThat(sold.getStatus()).isEqualTo(ProductStatus.OUT_OF_STOCK);
        assertThat(orderRepository.findAll())
                .extracting(OrderEntity::getOrderNumber)
                .doesNotHaveDuplicates()
                .hasSize(STOCK);
        assertThat(movementRepository.findByProduct_Id(productId)).hasSize(STOCK);
    }
}
