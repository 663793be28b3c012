package com.whereq.tessera.schema;

import com.whereq.tessera.exception.UnknownEngineException;
import com.whereq.tessera.exception.UnsupportedTypeException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Turns a canonical field list into CREATE TABLE statements, one per dialect.
 *
 * <p>Compilation is a pure function of {@code (tableName, fields, dialect)}:
 * no I/O, no clock, and member order always follows field order, so equal
 * inputs give byte-identical DDL.
 *
 * @author WhereQ Inc.
 */
@Component
public class SchemaCompiler {

    private final List<SqlDialect> dialects;

    @Autowired
    public SchemaCompiler() {
        this(SqlDialects.builtIn());
    }

    public SchemaCompiler(Collection<SqlDialect> dialects) {
        this.dialects = List.copyOf(dialects);
    }

    /**
     * Resolve a dialect by canonical id or alias
     *
     * @throws UnknownEngineException if no dialect answers to the id
     */
    public SqlDialect dialect(String engineId) {
        return dialects.stream()
            .filter(d -> d.answersTo(engineId))
            .findFirst()
            .orElseThrow(() -> new UnknownEngineException(engineId));
    }

    /**
     * Compile DDL for one engine
     *
     * @throws UnsupportedTypeException if a field type has no mapping in the dialect
     */
    public String compile(String tableName, List<SchemaField> fields, String engineId) {
        return compile(tableName, fields, dialect(engineId));
    }

    /**
     * Compile DDL for every known dialect, keyed by canonical engine id.
     * Fails on the first unsupported type, so no partial map is ever returned.
     */
    public Map<String, String> compileAll(String tableName, List<SchemaField> fields) {
        Map<String, String> ddl = new TreeMap<>();
        for (SqlDialect dialect : dialects) {
            ddl.put(dialect.getEngineId(), compile(tableName, fields, dialect));
        }
        return Collections.unmodifiableMap(ddl);
    }

    /**
     * CREATE VIEW over the table that lifts the members of every non-repeated
     * RECORD field into top-level columns named by their dotted path, e.g.
     * {@code address.city}. Repeated fields pass through unchanged, so the
     * view has the same rows as the table.
     *
     * @return empty when the fields hold no RECORD that can be flattened, or
     *         the dialect cannot read record members
     * @throws UnknownEngineException if no dialect answers to the id
     */
    public Optional<String> flattenedView(String tableName, List<SchemaField> fields, String engineId) {
        SqlDialect dialect = dialect(engineId);
        if (dialect.getMemberAccessFormat() == null || fields.stream().noneMatch(SchemaCompiler::isFlattenable)) {
            return Optional.empty();
        }

        List<String> columns = new ArrayList<>();
        for (SchemaField field : fields) {
            flatten(field, dialect.quote(field.getName()), field.getName(), dialect, columns);
        }
        return Optional.of("CREATE VIEW IF NOT EXISTS " + dialect.quote(flattenedViewName(tableName)) + " AS\nSELECT\n"
            + columns.stream().map(column -> "  " + column).collect(Collectors.joining(",\n"))
            + "\nFROM " + dialect.quote(tableName) + ";");
    }

    public static String flattenedViewName(String tableName) {
        return tableName + "_flattened";
    }

    private static boolean isFlattenable(SchemaField field) {
        return field.isNested() && field.getMode() != FieldMode.REPEATED;
    }

    private void flatten(SchemaField field, String expression, String path, SqlDialect dialect, List<String> columns) {
        if (isFlattenable(field)) {
            for (SchemaField child : field.getFields()) {
                String member = String.format(dialect.getMemberAccessFormat(), expression, child.getName().replace("'", "''"));
                flatten(child, member, path + "." + child.getName(), dialect, columns);
            }
        } else if (path.equals(field.getName())) {
            columns.add(expression);
        } else {
            columns.add(expression + " AS " + dialect.quote(path));
        }
    }

    String compile(String tableName, List<SchemaField> fields, SqlDialect dialect) {
        String columns = fields.stream()
            .map(field -> "  " + column(field, dialect))
            .collect(Collectors.joining(",\n"));

        return "CREATE TABLE IF NOT EXISTS " + dialect.quote(tableName) + " (\n"
            + columns + "\n)"
            + dialect.getTableSuffix() + ";";
    }

    private String column(SchemaField field, SqlDialect dialect) {
        String definition = dialect.quote(field.getName()) + " " + type(field, field.getName(), dialect);
        if (field.getMode() == FieldMode.REQUIRED && dialect.getRequiredSuffix() != null) {
            definition += dialect.getRequiredSuffix();
        }
        return definition;
    }

    private String type(SchemaField field, String path, SqlDialect dialect) {
        String base;
        boolean scalar = !field.isNested();
        if (scalar) {
            base = dialect.scalarType(field.getType())
                .orElseThrow(() -> new UnsupportedTypeException(dialect.getEngineId(), path, field.getType()));
        } else {
            String members = field.getFields().stream()
                .map(child -> dialect.quote(child.getName()) + " " + type(child, path + "." + child.getName(), dialect))
                .collect(Collectors.joining(", "));
            base = String.format(dialect.getStructFormat(), members);
        }

        if (field.getMode() == FieldMode.REPEATED) {
            return String.format(dialect.getArrayFormat(), base);
        }
        if (scalar && field.isNullable() && dialect.getNullableFormat() != null) {
            return String.format(dialect.getNullableFormat(), base);
        }
        return base;
    }
}
