package com.whereq.tessera.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConnectionPoolTest {

    @Mock
    private ConnectionPool.ConnectionFactory factory;

    @Mock
    private Connection first;

    @Mock
    private Connection second;

    @BeforeEach
    void setUp() throws SQLException {
        lenient().when(first.isValid(anyInt())).thenReturn(true);
        lenient().when(second.isValid(anyInt())).thenReturn(true);
    }

    @Test
    void reusesReturnedConnection() throws SQLException {
        when(factory.open()).thenReturn(first);
        ConnectionPool pool = new ConnectionPool("test", factory, 2, Duration.ofMillis(100));

        try (ConnectionPool.Lease lease = pool.borrow()) {
            assertThat(lease.connection()).isSameAs(first);
            assertThat(pool.getActiveCount()).isEqualTo(1);
        }
        try (ConnectionPool.Lease lease = pool.borrow()) {
            assertThat(lease.connection()).isSameAs(first);
        }

        verify(factory, times(1)).open();
        assertThat(pool.getOpenCount()).isEqualTo(1);
        assertThat(pool.getIdleCount()).isEqualTo(1);
        assertThat(pool.getActiveCount()).isZero();
    }

    @Test
    void exhaustedPoolTimesOut() throws SQLException {
        when(factory.open()).thenReturn(first);
        ConnectionPool pool = new ConnectionPool("test", factory, 1, Duration.ofMillis(50));

        try (ConnectionPool.Lease ignored = pool.borrow()) {
            assertThatThrownBy(pool::borrow).isInstanceOf(ConnectionPool.PoolExhaustedException.class);
        }
    }

    @Test
    void brokenConnectionIsDiscardedAndReplaced() throws SQLException {
        when(factory.open()).thenReturn(first, second);
        ConnectionPool pool = new ConnectionPool("test", factory, 1, Duration.ofMillis(100));

        try (ConnectionPool.Lease lease = pool.borrow()) {
            lease.markBroken();
        }
        verify(first).close();

        try (ConnectionPool.Lease lease = pool.borrow()) {
            assertThat(lease.connection()).isSameAs(second);
        }
        assertThat(pool.getOpenCount()).isEqualTo(1);
    }

    @Test
    void invalidIdleConnectionIsReplacedOnCheckout() throws SQLException {
        when(factory.open()).thenReturn(first, second);
        ConnectionPool pool = new ConnectionPool("test", factory, 1, Duration.ofMillis(100));
        pool.borrow().close();
        when(first.isValid(anyInt())).thenReturn(false);

        try (ConnectionPool.Lease lease = pool.borrow()) {
            assertThat(lease.connection()).isSameAs(second);
        }
        verify(first).close();
        assertThat(pool.getSessionResets()).isZero();
    }

    @Test
    void sessionBoundPoolCountsEveryReplacedConnection() throws SQLException {
        Connection third = mock(Connection.class);
        when(factory.open()).thenReturn(first, second, third);
        ConnectionPool pool = new ConnectionPool("session", factory, 1, Duration.ofMillis(100), true);

        pool.borrow().close();
        when(first.isValid(anyInt())).thenReturn(false);
        try (ConnectionPool.Lease lease = pool.borrow()) {
            assertThat(lease.connection()).isSameAs(second);
        }
        assertThat(pool.getSessionResets()).isEqualTo(1);

        try (ConnectionPool.Lease lease = pool.borrow()) {
            lease.markBroken();
        }
        assertThat(pool.getSessionResets()).isEqualTo(2);

        // closing the pool is not a reset
        try (ConnectionPool.Lease lease = pool.borrow()) {
            assertThat(lease.connection()).isSameAs(third);
        }
        pool.close();
        verify(third).close();
        assertThat(pool.getSessionResets()).isEqualTo(2);
    }

    @Test
    void failedOpenReleasesSlot() throws SQLException {
        when(factory.open()).thenThrow(new SQLException("refused")).thenReturn(first);
        ConnectionPool pool = new ConnectionPool("test", factory, 1, Duration.ofMillis(50));

        assertThatThrownBy(pool::borrow).hasMessage("refused");
        try (ConnectionPool.Lease lease = pool.borrow()) {
            assertThat(lease.connection()).isSameAs(first);
        }
    }

    @Test
    void doubleCloseOfLeaseReturnsOnce() throws SQLException {
        when(factory.open()).thenReturn(first);
        ConnectionPool pool = new ConnectionPool("test", factory, 1, Duration.ofMillis(50));

        ConnectionPool.Lease lease = pool.borrow();
        lease.close();
        lease.close();

        assertThat(pool.getActiveCount()).isZero();
        assertThat(pool.getIdleCount()).isEqualTo(1);
    }

    @Test
    void closingPoolClosesIdleConnectionsAndRejectsBorrow() throws SQLException {
        when(factory.open()).thenReturn(first);
        ConnectionPool pool = new ConnectionPool("test", factory, 1, Duration.ofMillis(50));
        pool.borrow().close();

        pool.close();

        verify(first).close();
        assertThatThrownBy(pool::borrow).isInstanceOf(SQLException.class).hasMessageContaining("closed");
        verify(factory, times(1)).open();
        verify(second, never()).close();
    }
}
