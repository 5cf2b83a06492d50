package com.example.commerce.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Body shape shared by every endpoint: {@code {success, data?, message?, errors?}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiEnvelope<T>(boolean success, T data, String message, Map<String, String> errors) {

    public static <T> ApiEnvelope<T> ok(T data) {
        return new ApiEnvelope<>(true, data, null, null);
    }

    public static <T> ApiEnvelope<T> ok(T data, String message) {
        return new ApiEnvelope<>(true, data, message, null);
    }

    public static ApiEnvelope<Void> message(String message) {
        return new ApiEnvelope<>(true, null, message, null);
    }

    public static ApiEnvelope<Void> error(String message) {
        return new ApiEnvelope<>(false, null, message, null);
    }

    public static ApiEnvelope<Void> error(String message, Map<String, String> errors) {
        return new ApiEnvelope<>(false, null, message, errors);
    }
}
