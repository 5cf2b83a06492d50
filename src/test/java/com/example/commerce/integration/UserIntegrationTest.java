package com.example.commerce.integration;

import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.UserStatus;
import com.example.commerce.infrastructure.persistence.entity.UserEntity;
import com.example.commerce.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;

class UserIntegrationTest extends IntegrationTestSupport {

    private UserEntity admin;

    @BeforeEach
    void seed() {
        admin = createUser(Role.ADMIN);
    }

    private WebTestClient.ResponseSpec createUser(UserEntity actor, String body) {
        return webTestClient.post()
                .uri("/api/users")
                .headers(as(actor))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    private WebTestClient.ResponseSpec updateUser(UserEntity actor, String userId, String body) {
        return webTestClient.put()
                .uri("/api/users/{id}", userId)
                .headers(as(actor))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    @Test
    @DisplayName("should_create_customer_with_normalized_email")
    void should_create_customer_with_normalized_email() {
        createUser(admin, "{ \"name\": \"Abebe Kebede\", \"email\": \" Abebe@Example.com \" }")
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.data.email").isEqualTo("abebe@example.com")
                .jsonPath("$.data.role").isEqualTo("CUSTOMER")
                .jsonPath("$.data.status").isEqualTo("ACTIVE")
                .jsonPath("$.data.totalOrders").isEqualTo(0);
    }

    @Test
    @DisplayName("should_reject_duplicate_email_ignoring_case")
    void should_reject_duplicate_email_ignoring_case() {
        createUser(admin, "{ \"name\": \"Abebe Kebede\", \"email\": \"abebe@example.com\" }").expectStatus().isCreated();

        createUser(admin, "{ \"name\": \"Abebe Two\", \"email\": \"ABEBE@example.com\" }")
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.message").isEqualTo("Email already registered")
                .jsonPath("$.errors.email").isEqualTo("Email already registered");
    }

    @Test
    @DisplayName("should_validate_email_format")
    void should_validate_email_format() {
        createUser(admin, "{ \"name\": \"Abebe Kebede\", \"email\": \"not-an-email\" }")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errors.email").isEqualTo("Invalid email address");
    }

    @Test
    @DisplayName("should_only_let_admins_create_users")
    void should_only_let_admins_create_users() {
        createUser(createUser(Role.MANAGER), "{ \"name\": \"Abebe Kebede\", \"email\": \"abebe@example.com\" }")
                .expectStatus().isForbidden();
    }

    @Test
    @DisplayName("should_let_users_edit_their_profile_but_not_their_role")
    void should_let_users_edit_their_profile_but_not_their_role() {
        // Given
        UserEntity customer = createCustomer();

        // When & Then
        updateUser(customer, customer.getId(), "{ \"city\": \"Hawassa\" }")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.city").isEqualTo("Hawassa");

        updateUser(customer, customer.getId(), "{ \"role\": \"ADMIN\" }")
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Only administrators can change status or role");

        assertThat(reload(customer).getRole()).isEqualTo(Role.CUSTOMER);
    }

    @Test
    @DisplayName("should_let_admin_deactivate_user")
    void should_let_admin_deactivate_user() {
        UserEntity customer = createCustomer();

        updateUser(admin, customer.getId(), "{ \"status\": \"SUSPENDED\" }")
                .expectStatus().isOk();

        assertThat(reload(customer).getStatus()).isEqualTo(UserStatus.SUSPENDED);
    }

    @Test
    @DisplayName("should_hide_other_profiles_from_customers")
    void should_hide_other_profiles_from_customers() {
        UserEntity customer = createCustomer();

        webTestClient.get()
                .uri("/api/users/{id}", customer.getId())
                .headers(as(createCustomer()))
                .exchange()
                .expectStatus().isForbidden();

        webTestClient.get()
                .uri("/api/users/{id}", customer.getId())
                .headers(as(createUser(Role.MANAGER)))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.id").isEqualTo(customer.getId());
    }

    @Test
    @DisplayName("should_filter_users_by_role")
    void should_filter_users_by_role() {
        createCustomer();
        createCustomer();
        createUser(Role.SELLER);

        webTestClient.get()
                .uri("/api/users?role=CUSTOMER")
                .headers(as(admin))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.pagination.total").isEqualTo(2);

        webTestClient.get()
                .uri("/api/users")
                .headers(as(createCustomer()))
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    @DisplayName("should_refuse_deleting_user_with_orders")
    void should_refuse_deleting_user_with_orders() {
        // Given
        UserEntity customer = createCustomer();
        placeOrder(customer, createProduct("Coffee Beans", "100.00", 5), 1, "cash_on_delivery");

        // When & Then
        webTestClient.delete()
                .uri("/api/users/{id}", customer.getId())
                .headers(as(admin))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Cannot delete a user with orders; deactivate the account instead");

        webTestClient.get()
                .uri("/api/users/{id}/orders", customer.getId())
                .headers(as(customer))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.items.length()").isEqualTo(1);
    }

    @Test
    @DisplayName("should_delete_user_without_orders")
    void should_delete_user_without_orders() {
        UserEntity customer = createCustomer();

        webTestClient.delete()
                .uri("/api/users/{id}", customer.getId())
                .headers(as(admin))
                .exchange()
                .expectStatus().isOk();

        assertThat(userRepository.existsById(customer.getId())).isFalse();
    }
}
