package com.example.commerce.domain.exception;

/**
 * Thrown when a unique attribute such as an email or slug is already taken.
 */
public class DuplicateResourceException extends DomainException {

    private final String field;

    public DuplicateResourceException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
