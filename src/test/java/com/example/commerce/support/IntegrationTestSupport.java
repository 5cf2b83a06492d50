package com.example.commerce.support;

import com.example.commerce.domain.model.ProductStatus;
import com.example.commerce.domain.model.Role;
import com.example.commerce.infrastructure.adapter.in.web.support.ActorArgumentResolver;
import com.example.commerce.infrastructure.persistence.entity.CategoryEntity;
import com.example.commerce.infrastructure.persistence.entity.ProductEntity;
import com.example.commerce.infrastructure.persistence.entity.UserEntity;
import com.example.commerce.infrastructure.persistence.repository.CategoryRepository;
import com.example.commerce.infrastructure.persistence.repository.InventoryMovementRepository;
import com.example.commerce.infrastructure.persistence.repository.NotificationRepository;
import com.example.commerce.infrastructure.persistence.repository.OrderItemRepository;
import com.example.commerce.infrastructure.persistence.repository.OrderRepository;
import com.example.commerce.infrastructure.persistence.repository.PaymentRepository;
import com.example.commerce.infrastructure.persistence.repository.ProductRepository;
import com.example.commerce.infrastructure.persistence.repository.SettingRepository;
import com.example.commerce.infrastructure.persistence.repository.UserRepository;
import com.jayway.jsonpath.JsonPath;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Base class for integration tests against the full application on an H2 in-memory database.
 * Every test starts from empty tables and closed circuit breakers.
 *
 * Note: For Testcontainers PostgreSQL tests, extend PostgresTestContainerSupport instead.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@ActiveProfiles("test")
public abstract class IntegrationTestSupport {

    @Autowired
    protected WebTestClient webTestClient;

    @Autowired
    protected UserRepository userRepository;

    @Autowired
    protected ProductRepository productRepository;

    @Autowired
    protected CategoryRepository categoryRepository;

    @Autowired
    protected OrderRepository orderRepository;

    @Autowired
    protected OrderItemRepository orderItemRepository;

    @Autowired
    protected PaymentRepository paymentRepository;

    @Autowired
    protected InventoryMovementRepository movementRepository;

    @Autowired
    protected NotificationRepository notificationRepository;

    @Autowired
    protected SettingRepository settingRepository;

    @Autowired(required = false)
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @BeforeEach
    void resetStateBeforeTest() {
        notificationRepository.deleteAllInBatch();
        paymentRepository.deleteAllInBatch();
        movementRepository.deleteAllInBatch();
        orderItemRepository.deleteAllInBatch();
        orderRepository.deleteAllInBatch();
        productRepository.deleteAllInBatch();
        categoryRepository.deleteAll(categoryRepository.findAll().stream()
                .filter(category -> category.getParent() != null)
                .toList());
        categoryRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
        settingRepository.deleteAllInBatch();

        if (circuitBreakerRegistry != null) {
            circuitBreakerRegistry.getAllCircuitBreakers()
                    .forEach(cb -> cb.reset());
        }
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", () -> "jdbc:h2:mem:commercedb_test;DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE;LOCK_TIMEOUT=10000");
        registry.add("spring.datasource.username", () -> "sa");
        registry.add("spring.datasource.password", () -> "");
        registry.add("spring.datasource.driver-class-name", () -> "org.h2.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
        registry.add("spring.jpa.properties.hibernate.dialect", () -> "org.hibernate.dialect.H2Dialect");
    }

    // ==================== Seed Data ====================

    protected UserEntity createUser(Role role) {
        UserEntity user = new UserEntity();
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        user.setName(role.name().charAt(0) + role.name().substring(1).toLowerCase() + " " + suffix);
        user.setEmail(role.name().toLowerCase() + "-" + suffix + "@example.com");
        user.setRole(role);
        return userRepository.save(user);
    }

    protected UserEntity createCustomer() {
        return createUser(Role.CUSTOMER);
    }

    /**
     * Saves an active product that tracks inventory.
     */
    protected ProductEntity createProduct(String name, String price, int stock) {
        return createProduct(name, price, stock, product -> {
        });
    }

    protected ProductEntity createProduct(String name, String price, int stock, Consumer<ProductEntity> customizer) {
        ProductEntity product = new ProductEntity();
        product.setName(name);
        product.setSlug(name.toLowerCase().replace(' ', '-') + "-" + UUID.randomUUID().toString().substring(0, 6));
        product.setPrice(new BigDecimal(price));
        product.setInitialStock(stock);
        product.changeStatus(stock > 0 ? ProductStatus.ACTIVE : ProductStatus.OUT_OF_STOCK);
        customizer.accept(product);
        return productRepository.save(product);
    }

    protected CategoryEntity createCategory(String name) {
        CategoryEntity category = new CategoryEntity();
        category.setName(name);
        category.setSlug(name.toLowerCase().replace(' ', '-'));
        category.setActive(true);
        return categoryRepository.save(category);
    }

    protected ProductEntity reload(ProductEntity product) {
        return productRepository.findById(product.getId()).orElseThrow();
    }

    protected UserEntity reload(UserEntity user) {
        return userRepository.findById(user.getId()).orElseThrow();
    }

    // ==================== Request Helpers ====================

    protected Consumer<HttpHeaders> as(UserEntity user) {
        return as(user.getId(), user.getRole());
    }

    protected Consumer<HttpHeaders> as(String userId, Role role) {
        return headers -> {
            headers.set(ActorArgumentResolver.USER_ID_HEADER, userId);
            headers.set(ActorArgumentResolver.USER_ROLE_HEADER, role.name());
        };
    }

    protected String orderRequest(String productId, int quantity, String paymentMethod) {
        return """
                {
                    "items": [ { "productId": "%s", "quantity": %d } ],
                    "shippingAddress": "Bole Road 12",
                    "shippingCity": "Addis Ababa",
                    "shippingCountry": "Ethiopia",
                    "paymentMethod": "%s"
                }
                """.formatted(productId, quantity, paymentMethod);
    }

    /**
     * Places an order through the API and returns its id.
     */
    protected String placeOrder(UserEntity customer, ProductEntity product, int quantity, String paymentMethod) {
        byte[] body = webTestClient.post()
                .uri("/api/orders")
                .headers(as(customer))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(orderRequest(product.getId(), quantity, paymentMethod))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .returnResult()
                .getResponseBody();
        return JsonPath.read(new String(body, StandardCharsets.UTF_8), "$.data.id");
    }
}
