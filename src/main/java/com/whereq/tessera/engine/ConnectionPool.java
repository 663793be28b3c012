package com.whereq.tessera.engine;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of JDBC connections owned by one adapter.
 *
 * <p>A connection is checked out for exactly one job through a {@link Lease}
 * and returned when the lease closes, on every exit path. Idle connections
 * are validated on checkout; broken ones are discarded and replaced.
 *
 * <p>A session-bound pool holds connections whose session state (temporary
 * tables, settings, an in-memory database) matters to later callers.
 * Replacing such a connection loses that state, which is logged as a
 * warning and counted in {@link #getSessionResets()}.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class ConnectionPool implements AutoCloseable {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final String name;
    private final ConnectionFactory factory;
    private final int maxSize;
    private final Duration borrowTimeout;
    private final Semaphore permits;
    private final Deque<Connection> idle = new ConcurrentLinkedDeque<>();
    private final AtomicInteger openCount = new AtomicInteger();
    private final AtomicInteger sessionResets = new AtomicInteger();
    private final boolean sessionBound;
    private volatile boolean closed;

    public ConnectionPool(String name, ConnectionFactory factory, int maxSize, Duration borrowTimeout) {
        this(name, factory, maxSize, borrowTimeout, false);
    }

    public ConnectionPool(String name, ConnectionFactory factory, int maxSize, Duration borrowTimeout,
                          boolean sessionBound) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1, got " + maxSize);
        }
        this.name = name;
        this.factory = factory;
        this.maxSize = maxSize;
        this.borrowTimeout = borrowTimeout;
        this.permits = new Semaphore(maxSize, true);
        this.sessionBound = sessionBound;
    }

    /**
     * Check out a connection, waiting up to the configured borrow timeout
     */
    public Lease borrow() throws SQLException {
        return borrow(borrowTimeout);
    }

    /**
     * Check out a connection
     *
     * @param timeout how long to wait for a free slot
     * @throws PoolExhaustedException if no slot frees up in time
     * @throws SQLException if a new connection cannot be opened
     */
    public Lease borrow(Duration timeout) throws SQLException {
        if (closed) {
            throw new SQLTransientConnectionException("Pool " + name + " is closed");
        }
        try {
            if (!permits.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new PoolExhaustedException(name, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLTransientConnectionException("Interrupted while waiting for a connection from " + name, e);
        }

        try {
            Connection connection;
            while ((connection = idle.pollFirst()) != null) {
                if (isUsable(connection)) {
                    return new Lease(connection);
                }
                replace(connection, "failed validation");
            }
            connection = factory.open();
            int open = openCount.incrementAndGet();
            log.debug("Opened connection for {} ({} of {})", name, open, maxSize);
            return new Lease(connection);
        } catch (SQLException | RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getOpenCount() {
        return openCount.get();
    }

    public int getIdleCount() {
        return idle.size();
    }

    public int getActiveCount() {
        return maxSize - permits.availablePermits();
    }

    /**
     * Connections of a session-bound pool that were replaced, losing their session state
     */
    public int getSessionResets() {
        return sessionResets.get();
    }

    @Override
    public void close() {
        closed = true;
        Connection connection;
        while ((connection = idle.pollFirst()) != null) {
            discard(connection);
        }
        log.info("Closed connection pool {}", name);
    }

    private void checkIn(Connection connection, boolean broken) {
        try {
            if (closed) {
                discard(connection);
            } else if (broken) {
                replace(connection, "was marked broken");
            } else {
                idle.offerFirst(connection);
            }
        } finally {
            permits.release();
        }
    }

    private boolean isUsable(Connection connection) {
        try {
            return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.debug("Validation of pooled connection for {} failed: {}", name, e.getMessage());
            return false;
        }
    }

    private void replace(Connection connection, String reason) {
        if (sessionBound) {
            int resets = sessionResets.incrementAndGet();
            log.warn("Session connection of {} {} and is discarded; its session state is lost "
                + "(tables and settings on an in-memory database), reset #{}", name, reason, resets);
        } else {
            log.warn("Discarding connection of {} that {}", name, reason);
        }
        discard(connection);
    }

    private void discard(Connection connection) {
        openCount.decrementAndGet();
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing discarded connection for {}: {}", name, e.getMessage());
        }
    }

    /**
     * Opens a new physical connection
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        Connection open() throws SQLException;
    }

    /**
     * Scoped checkout of one connection
     */
    public final class Lease implements AutoCloseable {
        private final Connection connection;
        private boolean broken;
        private boolean released;

        private Lease(Connection connection) {
            this.connection = connection;
        }

        public Connection connection() {
            return connection;
        }

        /**
         * Discard the connection on release instead of returning it to the pool
         */
        public void markBroken() {
            this.broken = true;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                checkIn(connection, broken);
            }
        }
    }

    /**
     * Thrown when every connection stays checked out for the whole borrow timeout
     */
    public static class PoolExhaustedException extends SQLTransientConnectionException {
        public PoolExhaustedException(String pool, Duration timeout) {
            super("No connection available from " + pool + " within " + timeout.toMillis() + "ms");
        }
    }
}
