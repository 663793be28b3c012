package com.whereq.tessera.exception;

/**
 * Exception thrown when a table name or field list is malformed
 */
public class SchemaValidationException extends RuntimeException {
    public SchemaValidationException(String message) {
        super(message);
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
