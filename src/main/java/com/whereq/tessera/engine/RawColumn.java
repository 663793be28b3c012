package com.whereq.tessera.engine;

import lombok.Value;

/**
 * Column as reported by the engine driver
 */
@Value
public class RawColumn {
    String name;

    /** Driver type name, e.g. "BIGINT" or "Nullable(Int64)" */
    String nativeType;

    /** {@link java.sql.Types} code */
    int jdbcType;
}
