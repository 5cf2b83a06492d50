package com.example.commerce.application.dto;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.Set;

/**
 * One-based page request with a sort field restricted to a whitelist.
 */
public record PageQuery(int page, int limit, String sortBy, String sortOrder) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    public PageQuery {
        page = Math.max(1, page);
        limit = limit < 1 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
    }

    public static PageQuery of(Integer page, Integer limit) {
        return new PageQuery(page == null ? 1 : page, limit == null ? DEFAULT_LIMIT : limit, null, null);
    }

    public static PageQuery of(Integer page, Integer limit, String sortBy, String sortOrder) {
        return new PageQuery(page == null ? 1 : page, limit == null ? DEFAULT_LIMIT : limit, sortBy, sortOrder);
    }

    /**
     * Builds a pageable, falling back to {@code createdAt} descending for unknown fields.
     */
    public Pageable toPageable(Set<String> sortable) {
        String field = sortBy != null && sortable.contains(sortBy) ? sortBy : "createdAt";
        Sort.Direction direction = "asc".equalsIgnoreCase(sortOrder) ? Sort.Direction.ASC : Sort.Direction.DESC;
        return PageRequest.of(page - 1, limit, Sort.by(direction, field));
    }

    public Pageable toPageable(Sort sort) {
        return PageRequest.of(page - 1, limit, sort);
    }
}
