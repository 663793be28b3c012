package com.whereq.tessera.schema;

import com.whereq.tessera.exception.NotFoundException;
import com.whereq.tessera.exception.SchemaValidationException;
import com.whereq.tessera.store.SchemaStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Versioned schema definitions keyed by logical table name.
 *
 * <p>Every registration appends a new version; identical field lists
 * still produce distinct versions.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaRegistry {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    private final SchemaStore store;
    private final SchemaCompiler compiler;
    private final Clock clock;

    /**
     * Register a new version of a table
     *
     * @param tableName logical table name
     * @param fields ordered field list
     * @param description optional free text
     * @return the stored definition, carrying the allocated version
     * @throws SchemaValidationException if the name or fields are malformed
     * @throws com.whereq.tessera.exception.UnsupportedTypeException if a dialect cannot express a field;
     *         nothing is stored in that case
     */
    public SchemaDefinition register(String tableName, List<SchemaField> fields, String description) {
        validateIdentifier(tableName, "table");
        validateFields(fields, tableName);

        // compile before taking a version so a failure leaves no trace
        Map<String, String> ddl = compiler.compileAll(tableName, fields);
        List<SchemaField> frozen = List.copyOf(fields);

        SchemaDefinition definition = store.append(tableName, version -> SchemaDefinition.builder()
            .tableName(tableName)
            .version(version)
            .description(description)
            .fields(frozen)
            .compiledDdl(ddl)
            .createdAt(clock.instant())
            .build());

        log.info("Registered schema {} version {} ({} fields, dialects {})",
            tableName, definition.getVersion(), fields.size(), ddl.keySet());
        return definition;
    }

    public SchemaDefinition register(String tableName, List<SchemaField> fields) {
        return register(tableName, fields, null);
    }

    public SchemaDefinition getCurrent(String tableName) {
        List<SchemaDefinition> history = store.history(tableName);
        if (history.isEmpty()) {
            throw NotFoundException.schema(tableName);
        }
        return history.get(history.size() - 1);
    }

    public SchemaDefinition getVersion(String tableName, int version) {
        List<SchemaDefinition> history = store.history(tableName);
        if (history.isEmpty()) {
            throw NotFoundException.schema(tableName);
        }
        if (version < 1 || version > history.size()) {
            throw NotFoundException.version(tableName, version);
        }
        return history.get(version - 1);
    }

    /**
     * Flattened-view DDL of a version, or of the current one when {@code version} is null
     *
     * @throws NotFoundException if the version does not exist or has no RECORD field to flatten
     * @throws com.whereq.tessera.exception.UnknownEngineException if no dialect answers to the id
     */
    public FlattenedView flattenedView(String tableName, Integer version, String engineId) {
        SchemaDefinition definition = version == null ? getCurrent(tableName) : getVersion(tableName, version);
        SqlDialect dialect = compiler.dialect(engineId);
        String sql = compiler.flattenedView(tableName, definition.getFields(), dialect.getEngineId())
            .orElseThrow(() -> new NotFoundException("Schema " + tableName + " version " + definition.getVersion()
                + " has no nested fields to flatten"));
        return FlattenedView.builder()
            .tableName(tableName)
            .version(definition.getVersion())
            .engineId(dialect.getEngineId())
            .viewName(SchemaCompiler.flattenedViewName(tableName))
            .sql(sql)
            .build();
    }

    /**
     * Version metadata, oldest first
     */
    public List<SchemaVersionInfo> listVersions(String tableName) {
        List<SchemaDefinition> history = store.history(tableName);
        if (history.isEmpty()) {
            throw NotFoundException.schema(tableName);
        }
        return history.stream().map(SchemaVersionInfo::of).toList();
    }

    public List<TableSummary> listTables() {
        return store.tableNames().stream()
            .map(store::history)
            .filter(history -> !history.isEmpty())
            .map(history -> {
                SchemaDefinition first = history.get(0);
                SchemaDefinition current = history.get(history.size() - 1);
                return TableSummary.builder()
                    .tableName(current.getTableName())
                    .currentVersion(current.getVersion())
                    .totalVersions(history.size())
                    .fieldCount(current.getFields().size())
                    .createdAt(first.getCreatedAt())
                    .lastUpdated(current.getCreatedAt())
                    .build();
            })
            .toList();
    }

    private void validateFields(List<SchemaField> fields, String path) {
        if (fields == null || fields.isEmpty()) {
            throw new SchemaValidationException(path + ": at least one field is required");
        }
        Set<String> seen = new HashSet<>();
        for (SchemaField field : fields) {
            if (field == null) {
                throw new SchemaValidationException(path + ": null field");
            }
            validateIdentifier(field.getName(), "field");
            String fieldPath = path + "." + field.getName();
            if (!seen.add(field.getName().toLowerCase())) {
                throw new SchemaValidationException("Duplicate field name: " + fieldPath);
            }
            if (field.getType() == null) {
                throw new SchemaValidationException(fieldPath + ": type is required");
            }
            if (field.isNested()) {
                validateFields(field.getFields(), fieldPath);
            } else if (!field.getFields().isEmpty()) {
                throw new SchemaValidationException(fieldPath + ": only RECORD fields may have nested fields");
            }
        }
    }

    private void validateIdentifier(String name, String what) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new SchemaValidationException("Invalid " + what + " name: '" + name
                + "' (letters, digits and underscores, not starting with a digit)");
        }
    }
}
