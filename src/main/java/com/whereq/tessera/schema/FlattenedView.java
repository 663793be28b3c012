package com.whereq.tessera.schema;

import lombok.Builder;
import lombok.Value;

/**
 * View DDL that exposes the nested members of a schema version as plain columns
 */
@Value
@Builder
public class FlattenedView {
    String tableName;
    int version;

    /** Canonical engine id the SQL is written for */
    String engineId;

    String viewName;
    String sql;
}
