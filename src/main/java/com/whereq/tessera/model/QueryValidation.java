package com.whereq.tessera.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Outcome of checking a query against an engine without running it
 */
@Value
@Builder
public class QueryValidation {

    private static final Pattern LEADING_KEYWORD = Pattern.compile(
        "^(?:\\s+|--[^\\n]*(?:\\n|$)|/\\*.*?\\*/|\\()*([A-Za-z]+)", Pattern.DOTALL);

    /** Canonical id of the engine that checked the query */
    String engineId;

    boolean valid;

    /** Leading statement keyword, e.g. SELECT or INSERT */
    String queryType;

    /** Engine messages; empty when valid */
    @Singular
    List<String> errors;

    /** What the engine would run, when it reports a plan */
    String planText;

    /**
     * Statement type from the first keyword, skipping comments and opening
     * parentheses. A {@code WITH} query counts as SELECT.
     *
     * @return upper-case keyword, or UNKNOWN
     */
    public static String statementType(String sql) {
        if (sql == null) {
            return "UNKNOWN";
        }
        Matcher matcher = LEADING_KEYWORD.matcher(sql);
        if (!matcher.find()) {
            return "UNKNOWN";
        }
        String keyword = matcher.group(1).toUpperCase(Locale.ROOT);
        return "WITH".equals(keyword) ? "SELECT" : keyword;
    }
}
