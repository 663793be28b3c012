package com.whereq.tessera.engine;

import com.whereq.tessera.model.ErrorKind;
import lombok.Getter;

/**
 * Classified failure raised by an engine adapter
 */
@Getter
public class EngineException extends Exception {

    private final ErrorKind kind;

    public EngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static EngineException cancelled() {
        return new EngineException(ErrorKind.CANCELLED, "Execution cancelled", null);
    }

    public static EngineException transientFailure(String message, Throwable cause) {
        return new EngineException(ErrorKind.TRANSIENT, message, cause);
    }

    public static EngineException failure(String message, Throwable cause) {
        return new EngineException(ErrorKind.ADAPTER_FAILURE, message, cause);
    }
}
