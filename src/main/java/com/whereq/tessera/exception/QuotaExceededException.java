package com.whereq.tessera.exception;

/**
 * Exception thrown when an engine queue is full
 */
public class QuotaExceededException extends RuntimeException {
    public QuotaExceededException(String message) {
        super(message);
    }
}
