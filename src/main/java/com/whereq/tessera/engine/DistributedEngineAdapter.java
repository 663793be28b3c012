package com.whereq.tessera.engine;

import com.whereq.tessera.config.TesseraProperties;
import com.whereq.tessera.model.EngineDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Properties;

/**
 * Adapter for a networked ClickHouse server over its HTTP JDBC driver.
 *
 * <p>Each job borrows its own pooled connection; the pool size is the
 * advertised concurrency.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class DistributedEngineAdapter extends AbstractJdbcEngineAdapter {

    public static final String ENGINE_ID = "clickhouse";
    public static final String ALIAS = "distributed";

    public DistributedEngineAdapter(TesseraProperties.Distributed config) {
        this(config, new ConnectionPool(ENGINE_ID, () -> open(config), config.getMaxConcurrency(),
            config.getBorrowTimeout()));
    }

    DistributedEngineAdapter(TesseraProperties.Distributed config, ConnectionPool pool) {
        super(EngineDescriptor.builder()
                .engineId(ENGINE_ID)
                .alias(ALIAS)
                .maxConcurrency(config.getMaxConcurrency())
                .capability(EngineDescriptor.Capability.EXECUTE)
                .capability(EngineDescriptor.Capability.CANCEL)
                .capability(EngineDescriptor.Capability.DESCRIBE_STATS)
                .build(),
            pool,
            config.isCapturePlan());
        log.info("Distributed engine adapter ready: url={}, maxConcurrency={}",
            config.getUrl(), config.getMaxConcurrency());
    }

    /**
     * The HTTP interface takes one statement per request: drop line
     * comments and trailing semicolons, and fold the text onto one line.
     */
    @Override
    protected String prepare(String queryText) {
        return cleanSql(queryText);
    }

    /**
     * EXPLAIN plans only SELECT; other statements are parsed with EXPLAIN AST,
     * which checks syntax but not the tables they name.
     */
    @Override
    protected String validationSql(String sql, String queryType) {
        return "SELECT".equals(queryType) ? "EXPLAIN " + sql : "EXPLAIN AST " + sql;
    }

    @Override
    protected boolean isConnectionFailure(SQLException e) {
        if (super.isConnectionFailure(e)) {
            return true;
        }
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        // 210 NETWORK_ERROR, 209 SOCKET_TIMEOUT
        return lower.contains("code: 210") || lower.contains("code: 209")
            || lower.contains("connection refused") || lower.contains("connection reset");
    }

    static String cleanSql(String sql) {
        StringBuilder out = new StringBuilder(sql.length());
        for (String line : sql.split("\\R")) {
            String code = stripLineComment(line).trim();
            if (!code.isEmpty()) {
                if (out.length() > 0) {
                    out.append(' ');
                }
                out.append(code);
            }
        }
        int end = out.length();
        while (end > 0 && (out.charAt(end - 1) == ';' || Character.isWhitespace(out.charAt(end - 1)))) {
            end--;
        }
        return out.substring(0, end);
    }

    private static String stripLineComment(String line) {
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '-' && i + 1 < line.length() && line.charAt(i + 1) == '-') {
                return line.substring(0, i);
            }
        }
        return line;
    }

    private static Connection open(TesseraProperties.Distributed config) throws SQLException {
        Properties info = new Properties();
        info.setProperty("user", config.getUsername());
        info.setProperty("password", config.getPassword() != null ? config.getPassword() : "");
        return DriverManager.getConnection(config.getUrl(), info);
    }
}
