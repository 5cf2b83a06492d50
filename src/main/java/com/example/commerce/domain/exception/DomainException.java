package com.example.commerce.domain.exception;

/**
 * Base class for business rule violations raised by the domain and application layers.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }

    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
