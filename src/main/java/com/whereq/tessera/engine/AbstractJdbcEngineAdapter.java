package com.whereq.tessera.engine;

import com.whereq.tessera.model.EngineDescriptor;
import com.whereq.tessera.model.QueryValidation;
import lombok.extern.slf4j.Slf4j;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * JDBC-backed adapter: one pooled connection and one statement per call.
 *
 * <p>Subclasses supply the pool and may rewrite the SQL or refine the
 * connection-failure test.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public abstract class AbstractJdbcEngineAdapter implements EngineAdapter {

    private static final Duration PING_TIMEOUT = Duration.ofSeconds(1);

    protected final ConnectionPool pool;
    private final EngineDescriptor descriptor;
    private final boolean capturePlan;

    protected AbstractJdbcEngineAdapter(EngineDescriptor descriptor, ConnectionPool pool, boolean capturePlan) {
        this.descriptor = descriptor;
        this.pool = pool;
        this.capturePlan = capturePlan;
    }

    @Override
    public EngineDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public RawResult execute(String queryText, CancellationToken token) throws EngineException {
        token.throwIfCancelled();
        String sql = prepare(queryText);

        try (ConnectionPool.Lease lease = pool.borrow()) {
            token.throwIfCancelled();
            try {
                return run(lease.connection(), sql, token);
            } catch (SQLException e) {
                if (token.isCancelled()) {
                    throw EngineException.cancelled();
                }
                if (isConnectionFailure(e)) {
                    lease.markBroken();
                    throw EngineException.transientFailure(describe(e), e);
                }
                throw EngineException.failure(describe(e), e);
            }
        } catch (SQLException e) {
            // checkout failed: pool exhausted or the engine refused a new connection
            if (isConnectionFailure(e)) {
                throw EngineException.transientFailure(describe(e), e);
            }
            throw EngineException.failure(describe(e), e);
        }
    }

    @Override
    public QueryValidation validate(String queryText) throws EngineException {
        String sql = prepare(queryText);
        String queryType = QueryValidation.statementType(sql);

        try (ConnectionPool.Lease lease = pool.borrow()) {
            try (Statement statement = lease.connection().createStatement();
                 ResultSet resultSet = statement.executeQuery(validationSql(sql, queryType))) {
                return QueryValidation.builder()
                    .engineId(descriptor.getEngineId())
                    .valid(true)
                    .queryType(queryType)
                    .planText(readPlan(resultSet))
                    .build();
            } catch (SQLException e) {
                if (isConnectionFailure(e)) {
                    lease.markBroken();
                    throw EngineException.transientFailure(describe(e), e);
                }
                log.debug("{} rejected query during validation: {}", descriptor.getEngineId(), e.getMessage());
                return QueryValidation.builder()
                    .engineId(descriptor.getEngineId())
                    .valid(false)
                    .queryType(queryType)
                    .error(describe(e))
                    .build();
            }
        } catch (SQLException e) {
            if (isConnectionFailure(e)) {
                throw EngineException.transientFailure(describe(e), e);
            }
            throw EngineException.failure(describe(e), e);
        }
    }

    @Override
    public boolean ping() {
        try (ConnectionPool.Lease lease = pool.borrow(PING_TIMEOUT);
             Statement statement = lease.connection().createStatement()) {
            statement.execute("SELECT 1");
            return true;
        } catch (ConnectionPool.PoolExhaustedException e) {
            log.debug("{} busy, every connection checked out", descriptor.getEngineId());
            return true;
        } catch (SQLException e) {
            log.debug("{} ping failed: {}", descriptor.getEngineId(), e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        pool.close();
    }

    public ConnectionPool getPool() {
        return pool;
    }

    /**
     * Rewrite the submitted text before it reaches the driver
     */
    protected String prepare(String queryText) {
        return queryText;
    }

    /**
     * Statement that makes the engine parse and plan {@code sql} without running it
     */
    protected String validationSql(String sql, String queryType) {
        return "EXPLAIN " + sql;
    }

    /**
     * Whether a failure came from the connection rather than the query
     */
    protected boolean isConnectionFailure(SQLException e) {
        if (e instanceof SQLTransientConnectionException
            || e instanceof SQLNonTransientConnectionException
            || e instanceof SQLRecoverableException) {
            return true;
        }
        String state = e.getSQLState();
        if (state != null && state.startsWith("08")) {
            return true;
        }
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof ConnectException
                || cause instanceof NoRouteToHostException
                || cause instanceof SocketTimeoutException
                || cause instanceof UnknownHostException
                || cause instanceof SocketException) {
                return true;
            }
        }
        return false;
    }

    private RawResult run(Connection connection, String sql, CancellationToken token)
            throws SQLException, EngineException {
        try (Statement statement = connection.createStatement();
             CancellationToken.Registration registration = token.onCancel(() -> cancelStatement(statement))) {

            long start = System.nanoTime();
            boolean hasResultSet = statement.execute(sql);
            List<RawColumn> columns = new ArrayList<>();
            List<List<Object>> rows = new ArrayList<>();
            if (hasResultSet) {
                try (ResultSet resultSet = statement.getResultSet()) {
                    read(resultSet, columns, rows, token);
                }
            }
            long wallTimeMs = (System.nanoTime() - start) / 1_000_000;
            token.throwIfCancelled();

            String plan = capturePlan && hasResultSet ? explain(connection, sql) : null;
            return RawResult.builder()
                .columns(columns)
                .rows(rows)
                .wallTimeMs(wallTimeMs)
                .planText(plan)
                .build();
        }
    }

    private void read(ResultSet resultSet, List<RawColumn> columns, List<List<Object>> rows, CancellationToken token)
            throws SQLException, EngineException {
        ResultSetMetaData meta = resultSet.getMetaData();
        int count = meta.getColumnCount();
        for (int i = 1; i <= count; i++) {
            columns.add(new RawColumn(meta.getColumnLabel(i), meta.getColumnTypeName(i), meta.getColumnType(i)));
        }
        while (resultSet.next()) {
            if (token.isCancelled()) {
                throw EngineException.cancelled();
            }
            List<Object> row = new ArrayList<>(count);
            for (int i = 1; i <= count; i++) {
                row.add(resultSet.getObject(i));
            }
            rows.add(row);
        }
    }

    private String explain(Connection connection, String sql) {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("EXPLAIN " + sql)) {
            return readPlan(resultSet);
        } catch (SQLException e) {
            log.debug("Plan capture failed on {}: {}", descriptor.getEngineId(), e.getMessage());
            return null;
        }
    }

    // plan text is in the last column, one line per row
    private static String readPlan(ResultSet resultSet) throws SQLException {
        int last = resultSet.getMetaData().getColumnCount();
        StringJoiner plan = new StringJoiner("\n");
        while (resultSet.next()) {
            String line = resultSet.getString(last);
            if (line != null) {
                plan.add(line);
            }
        }
        return plan.toString();
    }

    private void cancelStatement(Statement statement) {
        try {
            statement.cancel();
            log.info("Sent cancel to {}", descriptor.getEngineId());
        } catch (SQLException e) {
            log.warn("Cancel on {} failed: {}", descriptor.getEngineId(), e.getMessage());
        }
    }

    private static String describe(SQLException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
