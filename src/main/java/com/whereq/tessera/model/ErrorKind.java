package com.whereq.tessera.model;

/**
 * Classification of job and request failures
 */
public enum ErrorKind {
    UNKNOWN_ENGINE,
    NOT_FOUND,
    NOT_READY,
    UNSUPPORTED_TYPE,

    /**
     * Engine rejected or errored the query; message carries the engine text
     */
    ADAPTER_FAILURE,

    /**
     * Connection-level failure, safe to resubmit as a new job
     */
    TRANSIENT,

    CANCELLED,

    /**
     * Job was in flight when the process stopped
     */
    INTERRUPTED,

    /**
     * Exceeded the configured execution timeout
     */
    TIMEOUT
}
