package com.whereq.tessera.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.whereq.tessera.exception.SchemaValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Canonical field types of a schema definition, named after BigQuery
 * structured-record types. Legacy and standard SQL names are both accepted.
 */
public enum FieldType {
    INTEGER("INT64"),
    FLOAT("FLOAT64"),
    NUMERIC,
    BIGNUMERIC,
    BOOLEAN("BOOL"),
    STRING,
    BYTES,
    DATE,
    DATETIME,
    TIME,
    TIMESTAMP,
    RECORD("STRUCT"),
    JSON,
    GEOGRAPHY,
    INTERVAL;

    private final List<String> aliases;

    FieldType(String... aliases) {
        this.aliases = Arrays.asList(aliases);
    }

    public boolean isComposite() {
        return this == RECORD;
    }

    @JsonValue
    public String jsonName() {
        return name();
    }

    @JsonCreator
    public static FieldType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new SchemaValidationException("Field type is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (FieldType type : values()) {
            if (type.name().equals(normalized) || type.aliases.contains(normalized)) {
                return type;
            }
        }
        throw new SchemaValidationException("Unknown field type: " + name);
    }
}
