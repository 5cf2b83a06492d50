package com.example.commerce.infrastructure.config;

import com.example.commerce.domain.model.Actor;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.utils.SpringDocUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 */
@Configuration
public class OpenApiConfig {

    static {
        // Resolved from gateway headers, not from the request
        SpringDocUtils.getConfig().addRequestWrapperToIgnore(Actor.class);
    }

    @Bean
    public OpenAPI commerceServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Commerce Service API")
                        .description("""
                                E-commerce back end: catalog, orders, inventory, payments and dashboard.

                                ## Caller identity

                                Protected endpoints read `X-User-Id` and `X-User-Role`
                                (ADMIN, MANAGER, SELLER or CUSTOMER) set by the API gateway.

                                ## Payment resilience

                                Gateway calls run under the `paymentTL` time limiter and the
                                `paymentCB` circuit breaker. A timeout or an open circuit is
                                recorded as a FAILED payment.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Commerce Service Team")
                                .email("commerce-service@example.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
