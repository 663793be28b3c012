package com.whereq.tessera.normalizer;

import com.whereq.tessera.engine.RawColumn;
import com.whereq.tessera.model.ColumnType;

import java.sql.Types;
import java.util.Locale;
import java.util.Set;

/**
 * Maps engine type names (DuckDB and ClickHouse vocabularies) onto
 * {@link ColumnType}. Falls back to the JDBC type code, then to STRING.
 */
public final class NativeTypeMapper {

    private static final Set<String> INTEGER_TYPES = Set.of(
        "TINYINT", "SMALLINT", "INTEGER", "INT", "BIGINT", "HUGEINT",
        "UTINYINT", "USMALLINT", "UINTEGER", "UBIGINT", "UHUGEINT",
        "INT8", "INT16", "INT32", "INT64", "INT128", "INT256",
        "UINT8", "UINT16", "UINT32", "UINT64", "UINT128", "UINT256");

    private static final Set<String> FLOAT_TYPES = Set.of(
        "FLOAT", "REAL", "DOUBLE", "FLOAT32", "FLOAT64", "DECIMAL", "NUMERIC",
        "DECIMAL32", "DECIMAL64", "DECIMAL128", "DECIMAL256");

    private static final Set<String> BOOLEAN_TYPES = Set.of("BOOLEAN", "BOOL");

    private static final Set<String> TIMESTAMP_TYPES = Set.of(
        "DATE", "DATE32", "DATETIME", "DATETIME64", "TIMESTAMP", "TIMESTAMPTZ",
        "TIMESTAMP WITH TIME ZONE", "TIMESTAMP_S", "TIMESTAMP_MS", "TIMESTAMP_NS");

    private static final Set<String> STRUCT_TYPES = Set.of(
        "STRUCT", "TUPLE", "MAP", "ARRAY", "LIST", "NESTED", "UNION", "OBJECT");

    private NativeTypeMapper() {
    }

    public static ColumnType map(RawColumn column) {
        String name = baseName(column.getNativeType());
        if (name.endsWith("[]") || STRUCT_TYPES.contains(name)) {
            return ColumnType.STRUCT;
        }
        if (INTEGER_TYPES.contains(name)) {
            return ColumnType.INTEGER;
        }
        if (FLOAT_TYPES.contains(name)) {
            return ColumnType.FLOAT;
        }
        if (BOOLEAN_TYPES.contains(name)) {
            return ColumnType.BOOLEAN;
        }
        if (TIMESTAMP_TYPES.contains(name)) {
            return ColumnType.TIMESTAMP;
        }
        if (!name.isEmpty()) {
            return ColumnType.STRING;
        }
        return fromJdbcType(column.getJdbcType());
    }

    /**
     * Strip wrappers and parameters: {@code Nullable(LowCardinality(String))} is
     * {@code STRING}, {@code DECIMAL(18,3)} is {@code DECIMAL},
     * {@code DateTime64(6, 'UTC')} is {@code DATETIME64},
     * {@code SimpleAggregateFunction(sum, UInt64)} is {@code UINT64}.
     */
    static String baseName(String nativeType) {
        if (nativeType == null) {
            return "";
        }
        String name = nativeType.trim();
        boolean unwrapped = true;
        while (unwrapped) {
            unwrapped = false;
            for (String wrapper : new String[] {"Nullable(", "LowCardinality(", "SimpleAggregateFunction("}) {
                if (name.startsWith(wrapper) && name.endsWith(")")) {
                    name = name.substring(wrapper.length(), name.length() - 1).trim();
                    if (wrapper.startsWith("Simple")) {
                        // first argument is the aggregate function name
                        name = name.substring(name.indexOf(',') + 1).trim();
                    }
                    unwrapped = true;
                }
            }
        }
        if (name.endsWith("[]")) {
            return name.toUpperCase(Locale.ROOT);
        }
        int paren = name.indexOf('(');
        if (paren > 0) {
            name = name.substring(0, paren);
        }
        return name.trim().toUpperCase(Locale.ROOT);
    }

    private static ColumnType fromJdbcType(int jdbcType) {
        return switch (jdbcType) {
            case Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT -> ColumnType.INTEGER;
            case Types.FLOAT, Types.REAL, Types.DOUBLE, Types.DECIMAL, Types.NUMERIC -> ColumnType.FLOAT;
            case Types.BOOLEAN, Types.BIT -> ColumnType.BOOLEAN;
            case Types.DATE, Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> ColumnType.TIMESTAMP;
            case Types.STRUCT, Types.ARRAY, Types.JAVA_OBJECT, Types.OTHER -> ColumnType.STRUCT;
            default -> ColumnType.STRING;
        };
    }
}
