package com.whereq.tessera.model;

/**
 * Canonical column types shared by every engine
 */
public enum ColumnType {
    INTEGER,
    FLOAT,
    STRING,
    BOOLEAN,
    TIMESTAMP,
    STRUCT
}
