package com.whereq.tessera.dto;

import com.whereq.tessera.schema.SchemaField;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to register a new schema version
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaRegisterRequest {

    @NotBlank(message = "tableName is required")
    private String tableName;

    @NotEmpty(message = "fields must not be empty")
    private List<SchemaField> fields;

    private String description;
}
