package com.example.commerce.infrastructure.exception;

import com.example.commerce.domain.exception.DomainException;
import com.example.commerce.domain.exception.DuplicateResourceException;
import com.example.commerce.domain.exception.ForbiddenException;
import com.example.commerce.domain.exception.InsufficientStockException;
import com.example.commerce.domain.exception.NotFoundException;
import com.example.commerce.domain.exception.UnauthorizedException;
import com.example.commerce.infrastructure.adapter.in.web.dto.ApiEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for REST API. Every failure is answered with the
 * standard envelope and {@code success = false}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final boolean includeStackTrace;

    public GlobalExceptionHandler(@Value("${commerce.errors.include-stacktrace:false}") boolean includeStackTrace) {
        this.includeStackTrace = includeStackTrace;
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleNotFound(NotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ApiEnvelope.error(ex.getMessage()));
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleInsufficientStock(InsufficientStockException ex) {
        log.warn("Insufficient stock: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiEnvelope.error(ex.getMessage()));
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleUnauthorized(UnauthorizedException ex) {
        return respond(HttpStatus.UNAUTHORIZED, ApiEnvelope.error(ex.getMessage()));
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleForbidden(ForbiddenException ex) {
        log.debug("Forbidden: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ApiEnvelope.error(ex.getMessage()));
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleDuplicate(DuplicateResourceException ex) {
        log.warn("Duplicate {}: {}", ex.getField(), ex.getMessage());
        return respond(HttpStatus.CONFLICT,
                ApiEnvelope.error(ex.getMessage(), Map.of(ex.getField(), ex.getMessage())));
    }

    /**
     * Business-rule violations: invalid state, disallowed transitions.
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleDomainException(DomainException ex) {
        log.warn("Domain error: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiEnvelope.error(ex.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleValidation(WebExchangeBindException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        ex.getBindingResult().getGlobalErrors()
                .forEach(error -> errors.putIfAbsent(error.getObjectName(), error.getDefaultMessage()));
        log.debug("Validation failed: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, ApiEnvelope.error("Validation failed", errors));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleInput(ServerWebInputException ex) {
        log.debug("Invalid input: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST,
                ApiEnvelope.error(ex.getReason() != null ? ex.getReason() : "Invalid request"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiEnvelope.error(ex.getMessage()));
    }

    @ExceptionHandler({DataIntegrityViolationException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ApiEnvelope<Void>> handleConflict(RuntimeException ex) {
        log.warn("Conflicting write: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ApiEnvelope.error("The resource was modified concurrently or already exists"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleResponseStatus(ResponseStatusException ex) {
        String message = ex.getReason() != null ? ex.getReason() : ex.getStatusCode().toString();
        return ResponseEntity.status(ex.getStatusCode()).body(ApiEnvelope.error(message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiEnvelope<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        if (includeStackTrace) {
            return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                    ApiEnvelope.error("An unexpected error occurred", Map.of("stack", stackTraceOf(ex))));
        }
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ApiEnvelope.error("An unexpected error occurred"));
    }

    private static ResponseEntity<ApiEnvelope<Void>> respond(HttpStatus status, ApiEnvelope<Void> body) {
        return ResponseEntity.status(status).body(body);
    }

    private static String stackTraceOf(Throwable throwable) {
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
