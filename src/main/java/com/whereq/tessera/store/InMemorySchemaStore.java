package com.whereq.tessera.store;

import com.whereq.tessera.schema.SchemaDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntFunction;

/**
 * Schema versions held in memory, one copy-on-write list per table
 */
@Component
public class InMemorySchemaStore implements SchemaStore {

    private final Map<String, List<SchemaDefinition>> versions = new ConcurrentHashMap<>();

    @Override
    public SchemaDefinition append(String tableName, IntFunction<SchemaDefinition> factory) {
        AtomicReference<SchemaDefinition> stored = new AtomicReference<>();
        // compute holds the bin lock for this key, which serializes version allocation per table
        versions.compute(tableName, (name, existing) -> {
            List<SchemaDefinition> next = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            SchemaDefinition definition = factory.apply(next.size() + 1);
            next.add(definition);
            stored.set(definition);
            return Collections.unmodifiableList(next);
        });
        return stored.get();
    }

    @Override
    public List<SchemaDefinition> history(String tableName) {
        return versions.getOrDefault(tableName, List.of());
    }

    @Override
    public Set<String> tableNames() {
        return Collections.unmodifiableSet(new TreeSet<>(versions.keySet()));
    }
}
