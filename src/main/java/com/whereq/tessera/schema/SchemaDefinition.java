package com.whereq.tessera.schema;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One immutable version of a logical table's shape, with the DDL
 * compiled for every known dialect at registration time.
 *
 * @author WhereQ Inc.
 */
@Value
@Builder
public class SchemaDefinition {
    /** Logical table name, stable across versions */
    String tableName;

    /** 1-based, gapless per table */
    int version;

    String description;

    List<SchemaField> fields;

    /** Canonical engine id to DDL text */
    Map<String, String> compiledDdl;

    Instant createdAt;
}
