package com.whereq.tessera.exception;

import com.whereq.tessera.schema.FieldType;
import lombok.Getter;

/**
 * Exception thrown when a schema field type has no mapping in a dialect
 */
@Getter
public class UnsupportedTypeException extends RuntimeException {
    private final String engineId;
    private final String fieldName;
    private final FieldType type;

    public UnsupportedTypeException(String engineId, String fieldName, FieldType type) {
        super("Field '" + fieldName + "' has type " + type + " which " + engineId + " does not support");
        this.engineId = engineId;
        this.fieldName = fieldName;
        this.type = type;
    }
}
