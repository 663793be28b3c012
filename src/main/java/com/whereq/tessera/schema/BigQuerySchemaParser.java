package com.whereq.tessera.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tessera.exception.SchemaValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Reads BigQuery JSON schema files.
 *
 * <p>Accepted shapes: a bare array of fields, {@code {"fields": [...]}} or
 * {@code {"schema": {"fields": [...]}}} as exported by table metadata.
 */
@Component
@RequiredArgsConstructor
public class BigQuerySchemaParser {

    private static final TypeReference<List<SchemaField>> FIELD_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public List<SchemaField> parse(byte[] content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("Schema file is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SchemaValidationException("Schema file could not be read: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new SchemaValidationException("Schema file is empty");
        }

        JsonNode fields = root;
        if (root.isObject()) {
            fields = root.has("schema") ? root.path("schema").path("fields") : root.path("fields");
        }
        if (!fields.isArray()) {
            throw new SchemaValidationException("Schema file must contain an array of fields");
        }

        try {
            return objectMapper.convertValue(fields, FIELD_LIST);
        } catch (IllegalArgumentException e) {
            // unwrap validation errors raised while binding types and modes
            Throwable cause = e.getCause();
            while (cause != null) {
                if (cause instanceof SchemaValidationException sve) {
                    throw sve;
                }
                cause = cause.getCause();
            }
            throw new SchemaValidationException("Malformed schema field: " + e.getMessage(), e);
        }
    }
}
