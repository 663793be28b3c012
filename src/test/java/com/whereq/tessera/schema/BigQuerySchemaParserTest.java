package com.whereq.tessera.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tessera.exception.SchemaValidationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BigQuerySchemaParserTest {

    private final BigQuerySchemaParser parser = new BigQuerySchemaParser(new ObjectMapper());

    private List<SchemaField> parse(String json) {
        return parser.parse(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void parsesBareFieldArray() {
        List<SchemaField> fields = parse("""
            [
              {"name": "id", "type": "INT64", "mode": "REQUIRED"},
              {"name": "score", "type": "float"},
              {"name": "tags", "type": "STRING", "mode": "REPEATED", "description": "labels"}
            ]
            """);

        assertThat(fields).extracting(SchemaField::getName).containsExactly("id", "score", "tags");
        assertThat(fields.get(0).getType()).isEqualTo(FieldType.INTEGER);
        assertThat(fields.get(0).getMode()).isEqualTo(FieldMode.REQUIRED);
        assertThat(fields.get(1).getType()).isEqualTo(FieldType.FLOAT);
        assertThat(fields.get(1).getMode()).isEqualTo(FieldMode.NULLABLE);
        assertThat(fields.get(2).getDescription()).isEqualTo("labels");
    }

    @Test
    void parsesTableMetadataExportWithNestedRecords() {
        List<SchemaField> fields = parse("""
            {
              "tableReference": {"tableId": "orders"},
              "schema": {
                "fields": [
                  {"name": "customer", "type": "STRUCT", "fields": [
                    {"name": "email", "type": "STRING"},
                    {"name": "vip", "type": "BOOL"}
                  ]}
                ]
              }
            }
            """);

        SchemaField customer = fields.get(0);
        assertThat(customer.getType()).isEqualTo(FieldType.RECORD);
        assertThat(customer.getFields())
            .extracting(SchemaField::getName, SchemaField::getType)
            .containsExactly(
                org.assertj.core.groups.Tuple.tuple("email", FieldType.STRING),
                org.assertj.core.groups.Tuple.tuple("vip", FieldType.BOOLEAN));
    }

    @Test
    void parsesFieldsObject() {
        assertThat(parse("{\"fields\": [{\"name\": \"d\", \"type\": \"DATE\"}]}"))
            .extracting(SchemaField::getType)
            .containsExactly(FieldType.DATE);
    }

    @Test
    void unknownTypeIsAValidationError() {
        assertThatThrownBy(() -> parse("[{\"name\": \"x\", \"type\": \"VARIANT\"}]"))
            .isInstanceOf(SchemaValidationException.class)
            .hasMessageContaining("VARIANT");
    }

    @Test
    void rejectsInvalidJsonAndWrongShape() {
        assertThatThrownBy(() -> parse("[{\"name\": "))
            .isInstanceOf(SchemaValidationException.class)
            .hasMessageStartingWith("Schema file is not valid JSON: ");
        assertThatThrownBy(() -> parse("{\"fields\": [} "))
            .isInstanceOf(SchemaValidationException.class)
            .hasMessageStartingWith("Schema file is not valid JSON: ");
        assertThatThrownBy(() -> parse("{\"columns\": []}"))
            .isInstanceOf(SchemaValidationException.class)
            .hasMessageContaining("array of fields");
    }
}
