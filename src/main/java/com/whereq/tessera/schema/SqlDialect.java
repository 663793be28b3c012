package com.whereq.tessera.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Table-definition rules of one engine, expressed as data.
 *
 * <p>The compiler reads only this descriptor, so supporting another engine
 * means adding one more instance to {@link SqlDialects}.
 *
 * <p>Format strings take a single {@code %s} argument, except
 * {@link #memberAccessFormat}.
 */
@Value
@Builder
public class SqlDialect {

    /** Canonical engine id, used as the key of compiled DDL. */
    String engineId;

    @Singular("alias")
    Set<String> aliases;

    /** Display name. */
    String name;

    /** Character used to quote identifiers; doubled when it occurs inside one. */
    String identifierQuote;

    /** Scalar type mapping; a missing entry means the type is unsupported. */
    @Singular("scalarType")
    Map<FieldType, String> scalarTypes;

    /** Wraps the element type of a REPEATED field. */
    String arrayFormat;

    /** Wraps the comma-separated member list of a RECORD field. */
    String structFormat;

    /** Wraps a NULLABLE scalar type, or null when columns are nullable by default. */
    String nullableFormat;

    /** Appended to a top-level REQUIRED column, or null when not expressible. */
    String requiredSuffix;

    /**
     * Reads one member of a RECORD value: {@code %s} the record expression,
     * then the member name. Null when the dialect offers no flattened views.
     */
    String memberAccessFormat;

    /** Text after the closing parenthesis, before the semicolon. */
    @Builder.Default
    String tableSuffix = "";

    public Optional<String> scalarType(FieldType type) {
        return Optional.ofNullable(scalarTypes.get(type));
    }

    public String quote(String identifier) {
        return identifierQuote + identifier.replace(identifierQuote, identifierQuote + identifierQuote) + identifierQuote;
    }

    public boolean answersTo(String id) {
        return engineId.equalsIgnoreCase(id) || aliases.stream().anyMatch(a -> a.equalsIgnoreCase(id));
    }
}
