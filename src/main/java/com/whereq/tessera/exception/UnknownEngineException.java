package com.whereq.tessera.exception;

import lombok.Getter;

/**
 * Exception thrown when no adapter is registered for an engine id
 */
@Getter
public class UnknownEngineException extends RuntimeException {
    private final String engineId;

    public UnknownEngineException(String engineId) {
        super("Unknown engine: " + engineId);
        this.engineId = engineId;
    }
}
