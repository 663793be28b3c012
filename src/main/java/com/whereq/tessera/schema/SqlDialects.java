package com.whereq.tessera.schema;

import java.util.List;

/**
 * Built-in dialects.
 *
 * @author WhereQ Inc.
 */
public final class SqlDialects {

    public static final SqlDialect DUCKDB = SqlDialect.builder()
        .engineId("duckdb")
        .alias("embedded")
        .name("DuckDB")
        .identifierQuote("\"")
        .scalarType(FieldType.INTEGER, "BIGINT")
        .scalarType(FieldType.FLOAT, "DOUBLE")
        .scalarType(FieldType.NUMERIC, "DECIMAL(38, 9)")
        .scalarType(FieldType.BOOLEAN, "BOOLEAN")
        .scalarType(FieldType.STRING, "VARCHAR")
        .scalarType(FieldType.BYTES, "BLOB")
        .scalarType(FieldType.DATE, "DATE")
        .scalarType(FieldType.DATETIME, "TIMESTAMP")
        .scalarType(FieldType.TIME, "TIME")
        .scalarType(FieldType.TIMESTAMP, "TIMESTAMP WITH TIME ZONE")
        .scalarType(FieldType.JSON, "JSON")
        .scalarType(FieldType.INTERVAL, "INTERVAL")
        .arrayFormat("%s[]")
        .structFormat("STRUCT(%s)")
        .memberAccessFormat("struct_extract(%s, '%s')")
        .requiredSuffix(" NOT NULL")
        .build();

    public static final SqlDialect CLICKHOUSE = SqlDialect.builder()
        .engineId("clickhouse")
        .alias("distributed")
        .name("ClickHouse")
        .identifierQuote("`")
        .scalarType(FieldType.INTEGER, "Int64")
        .scalarType(FieldType.FLOAT, "Float64")
        .scalarType(FieldType.NUMERIC, "Decimal(38, 9)")
        .scalarType(FieldType.BIGNUMERIC, "Decimal256(38)")
        .scalarType(FieldType.BOOLEAN, "Bool")
        .scalarType(FieldType.STRING, "String")
        .scalarType(FieldType.BYTES, "String")
        .scalarType(FieldType.DATE, "Date32")
        .scalarType(FieldType.DATETIME, "DateTime64(6)")
        .scalarType(FieldType.TIMESTAMP, "DateTime64(6, 'UTC')")
        .scalarType(FieldType.JSON, "String")
        .arrayFormat("Array(%s)")
        .structFormat("Tuple(%s)")
        .memberAccessFormat("tupleElement(%s, '%s')")
        .nullableFormat("Nullable(%s)")
        .tableSuffix("\nENGINE = MergeTree()\nORDER BY tuple()")
        .build();

    private SqlDialects() {
    }

    public static List<SqlDialect> builtIn() {
        return List.of(DUCKDB, CLICKHOUSE);
    }
}
