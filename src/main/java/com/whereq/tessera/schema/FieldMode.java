package com.whereq.tessera.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.whereq.tessera.exception.SchemaValidationException;

import java.util.Locale;

/**
 * Field cardinality
 */
public enum FieldMode {
    /**
     * Zero or one value (default)
     */
    NULLABLE,

    /**
     * Exactly one value
     */
    REQUIRED,

    /**
     * Zero or more values
     */
    REPEATED;

    @JsonCreator
    public static FieldMode fromName(String name) {
        if (name == null || name.isBlank()) {
            return NULLABLE;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SchemaValidationException("Unknown field mode: " + name, e);
        }
    }
}
