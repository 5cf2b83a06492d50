package com.example.commerce.domain.exception;

/**
 * Thrown when an operation is not allowed in the current state of a resource.
 */
public class InvalidStateException extends DomainException {

    public InvalidStateException(String message) {
        super(message);
    }
}
