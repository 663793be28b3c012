package com.whereq.tessera.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation signal scoped to one job.
 *
 * <p>Adapters poll {@link #isCancelled()} between steps and register a
 * callback that aborts the engine call in progress (for JDBC,
 * {@code Statement.cancel()}). A token fires at most once.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class CancellationToken {

    public enum Reason {
        /** Cancel requested by a client */
        USER,

        /** Execution timeout reached */
        TIMEOUT
    }

    private final List<Runnable> callbacks = new ArrayList<>();
    private Reason reason;

    /**
     * Signal cancellation and run registered callbacks
     *
     * @return true if this call fired the token, false if it had already fired
     */
    public boolean cancel(Reason reason) {
        List<Runnable> toRun;
        synchronized (this) {
            if (this.reason != null) {
                return false;
            }
            this.reason = reason;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(CancellationToken::runCallback);
        return true;
    }

    public synchronized boolean isCancelled() {
        return reason != null;
    }

    public synchronized Reason getReason() {
        return reason;
    }

    /**
     * Register an abort hook. Runs immediately if the token has already fired.
     *
     * @return registration to close once the guarded call has finished
     */
    public Registration onCancel(Runnable callback) {
        synchronized (this) {
            if (reason == null) {
                callbacks.add(callback);
                return () -> {
                    synchronized (CancellationToken.this) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runCallback(callback);
        return () -> { };
    }

    /**
     * @throws EngineException of kind CANCELLED if the token has fired
     */
    public void throwIfCancelled() throws EngineException {
        if (isCancelled()) {
            throw EngineException.cancelled();
        }
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Scoped callback registration
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
