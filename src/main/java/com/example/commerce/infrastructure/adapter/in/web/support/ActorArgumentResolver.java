package com.example.commerce.infrastructure.adapter.in.web.support;

import com.example.commerce.domain.exception.UnauthorizedException;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.Role;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.BindingContext;
import org.springframework.web.reactive.result.method.HandlerMethodArgumentResolver;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Resolves {@link Actor} controller parameters from the identity headers set by the
 * upstream gateway. A handler that declares an {@code Actor} requires a caller.
 */
public class ActorArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Actor.class.equals(parameter.getParameterType());
    }

    @Override
    public Mono<Object> resolveArgument(MethodParameter parameter, BindingContext bindingContext,
                                        ServerWebExchange exchange) {
        return Mono.fromCallable(() -> resolve(exchange.getRequest().getHeaders()));
    }

    static Actor resolve(HttpHeaders headers) {
        String userId = headers.getFirst(USER_ID_HEADER);
        String role = headers.getFirst(USER_ROLE_HEADER);
        if (userId == null || userId.isBlank() || role == null || role.isBlank()) {
            throw new UnauthorizedException("Authentication required");
        }
        try {
            return Actor.of(userId.trim(), Role.valueOf(role.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("Unknown role: " + role);
        }
    }
}
