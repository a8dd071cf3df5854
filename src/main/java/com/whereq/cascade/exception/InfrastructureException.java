package com.whereq.cascade.exception;

/**
 * Exception thrown when the batch cannot start at all (missing executable, unreadable input, bad arguments)
 */
public class InfrastructureException extends RuntimeException {
    public InfrastructureException(String message) {
        super(message);
    }

    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
