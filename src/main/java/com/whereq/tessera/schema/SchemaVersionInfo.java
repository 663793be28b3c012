package com.whereq.tessera.schema;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Version metadata returned by version listings
 */
@Value
@Builder
public class SchemaVersionInfo {
    int version;
    int fieldCount;
    String description;
    Instant createdAt;

    public static SchemaVersionInfo of(SchemaDefinition definition) {
        return SchemaVersionInfo.builder()
            .version(definition.getVersion())
            .fieldCount(definition.getFields().size())
            .description(definition.getDescription())
            .createdAt(definition.getCreatedAt())
            .build();
    }
}
