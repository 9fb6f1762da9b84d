package com.fanhub.subscription.exception;

/**
 * Exception thrown when the subscription store (database or lock service) fails.
 * Callers may retry; subscribe is idempotent.
 *
 * @author FanHub Team
 */
public class StorageException extends RuntimeException {

    private final String operation;

    public StorageException(String operation, String message, Throwable cause) {
        super(String.format("Storage failure during %s: %s", operation, message), cause);
        this.operation = operation;
    }

    public StorageException(String operation, String message) {
        this(operation, message, null);
    }

    public String getOperation() {
        return operation;
    }
}
