package com.whereq.tessera.engine;

import com.whereq.tessera.config.TesseraProperties;
import com.whereq.tessera.model.EngineDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.regex.Pattern;

/**
 * Adapter for the in-process DuckDB engine.
 *
 * <p>DuckDB allows one query context per connection, so the adapter keeps a
 * single connection and advertises {@code maxConcurrency = 1}. The same
 * connection serves every job in turn: tables created by one job stay
 * visible to later ones for as long as that connection lives.
 *
 * <p>If the connection breaks or fails validation the pool opens a new one.
 * With an in-memory url that is a fresh, empty database; the pool logs the
 * reset as a warning.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class EmbeddedEngineAdapter extends AbstractJdbcEngineAdapter {

    public static final String ENGINE_ID = "duckdb";
    public static final String ALIAS = "embedded";

    private static final Pattern MEMORY_LIMIT = Pattern.compile("^\\d+(\\.\\d+)?\\s*[KMGT]?i?B$", Pattern.CASE_INSENSITIVE);

    public EmbeddedEngineAdapter(TesseraProperties.Embedded config) {
        super(descriptor(config.isCapturePlan()),
            new ConnectionPool(ENGINE_ID, () -> open(config), 1, config.getBorrowTimeout(), true),
            config.isCapturePlan());
        log.info("Embedded engine adapter ready: url={}, memoryLimit={}", config.getUrl(), config.getMemoryLimit());
    }

    private static EngineDescriptor descriptor(boolean capturePlan) {
        EngineDescriptor.EngineDescriptorBuilder builder = EngineDescriptor.builder()
            .engineId(ENGINE_ID)
            .alias(ALIAS)
            .maxConcurrency(1)
            .capability(EngineDescriptor.Capability.EXECUTE)
            .capability(EngineDescriptor.Capability.CANCEL);
        if (capturePlan) {
            builder.capability(EngineDescriptor.Capability.DESCRIBE_STATS);
        }
        return builder.build();
    }

    private static Connection open(TesseraProperties.Embedded config) throws SQLException {
        Connection connection = DriverManager.getConnection(config.getUrl());
        String limit = config.getMemoryLimit();
        if (limit != null && !limit.isBlank()) {
            if (!MEMORY_LIMIT.matcher(limit.trim()).matches()) {
                connection.close();
                throw new SQLException("Invalid memory limit: " + limit);
            }
            try (Statement statement = connection.createStatement()) {
                statement.execute("SET memory_limit = '" + limit.trim() + "'");
            } catch (SQLException e) {
                connection.close();
                throw e;
            }
        }
        return connection;
    }
}
