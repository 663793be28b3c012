package com.whereq.tessera.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One column of a schema definition. RECORD fields carry nested children.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaField {
    String name;

    FieldType type;

    @Builder.Default
    FieldMode mode = FieldMode.NULLABLE;

    String description;

    /** Children of a RECORD field, in declaration order */
    @Singular
    List<SchemaField> fields;

    @JsonIgnore
    public boolean isNullable() {
        return mode != FieldMode.REQUIRED;
    }

    @JsonIgnore
    public boolean isNested() {
        return type != null && type.isComposite();
    }

    public static SchemaField of(String name, FieldType type) {
        return SchemaField.builder().name(name).type(type).build();
    }

    public static SchemaField of(String name, FieldType type, FieldMode mode) {
        return SchemaField.builder().name(name).type(type).mode(mode).build();
    }
}
