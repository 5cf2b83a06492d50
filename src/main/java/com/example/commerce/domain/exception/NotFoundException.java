package com.example.commerce.domain.exception;

/**
 * Thrown when a referenced user, product, order, payment or setting does not exist.
 */
public class NotFoundException extends DomainException {

    private final String resource;

    public NotFoundException(String resource) {
        super(resource + " not found");
        this.resource = resource;
    }

    public NotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
