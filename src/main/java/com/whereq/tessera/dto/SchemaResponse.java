package com.whereq.tessera.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.tessera.schema.SchemaDefinition;
import com.whereq.tessera.schema.SchemaField;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One schema version with its compiled DDL
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SchemaResponse {
    private String tableName;
    private Integer version;
    private String description;
    private List<SchemaField> fields;

    /** Engine id to DDL text */
    private Map<String, String> compiledDdl;

    private Instant createdAt;

    /** Kind of failure, e.g. UNSUPPORTED_TYPE */
    private String errorKind;
    private String errorMessage;

    public static SchemaResponse from(SchemaDefinition definition) {
        return SchemaResponse.builder()
            .tableName(definition.getTableName())
            .version(definition.getVersion())
            .description(definition.getDescription())
            .fields(definition.getFields())
            .compiledDdl(definition.getCompiledDdl())
            .createdAt(definition.getCreatedAt())
            .build();
    }

    public static SchemaResponse error(String tableName, String errorKind, String message) {
        return SchemaResponse.builder()
            .tableName(tableName)
            .errorKind(errorKind)
            .errorMessage(message)
            .build();
    }
}
