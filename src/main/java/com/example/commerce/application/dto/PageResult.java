package com.example.commerce.application.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * A page of results with one-based pagination metadata.
 */
public record PageResult<T>(List<T> items, Pagination pagination) {

    public static <E, T> PageResult<T> from(Page<E> page, Function<E, T> mapper) {
        List<T> items = page.getContent().stream().map(mapper).toList();
        return new PageResult<>(items, new Pagination(
                page.getNumber() + 1,
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages()));
    }

    public record Pagination(int page, int limit, long total, int totalPages) {
    }
}
