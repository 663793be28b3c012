package com.whereq.tessera.exception;

/**
 * Exception thrown when a job, schema or schema version does not exist
 */
public class NotFoundException extends RuntimeException {
    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException job(String jobId) {
        return new NotFoundException("Job not found: " + jobId);
    }

    public static NotFoundException schema(String tableName) {
        return new NotFoundException("Schema not found: " + tableName);
    }

    public static NotFoundException version(String tableName, int version) {
        return new NotFoundException("Schema " + tableName + " has no version " + version);
    }
}
