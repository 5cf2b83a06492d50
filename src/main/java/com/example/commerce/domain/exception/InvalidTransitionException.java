package com.example.commerce.domain.exception;

/**
 * Thrown when a requested status edge is missing from the transition table.
 */
public class InvalidTransitionException extends InvalidStateException {

    private final String from;
    private final String to;

    public InvalidTransitionException(String kind, String from, String to) {
        super(String.format("Invalid %s transition from %s to %s", kind, from, to));
        this.from = from;
        this.to = to;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }
}
