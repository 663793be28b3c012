package com.whereq.tessera.store;

import com.whereq.tessera.schema.SchemaDefinition;

import java.util.List;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Append-only storage of schema versions
 */
public interface SchemaStore {

    /**
     * Atomically allocate the next version of a table and store the
     * definition built for it. Concurrent appends for the same table are
     * serialized, so no two definitions ever share a version number.
     *
     * @param tableName logical table name
     * @param factory builds the definition for the allocated version
     * @return the stored definition
     */
    SchemaDefinition append(String tableName, IntFunction<SchemaDefinition> factory);

    /**
     * All versions of a table, oldest first; empty if the table is unknown
     */
    List<SchemaDefinition> history(String tableName);

    Set<String> tableNames();
}
