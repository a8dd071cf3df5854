package com.whereq.cascade.exception;

/**
 * Exception thrown when the job specification file is missing, unreadable or has no usable records
 */
public class InvalidJobSpecificationException extends InfrastructureException {
    public InvalidJobSpecificationException(String message) {
        super(message);
    }

    public InvalidJobSpecificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
