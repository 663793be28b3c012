package com.whereq.tessera.engine;

import com.whereq.tessera.model.EngineDescriptor;
import com.whereq.tessera.model.QueryValidation;

/**
 * Uniform surface over one execution engine.
 *
 * <p>Adapters receive only the query text and a cancellation token, never
 * the job record. An adapter must not carry session state from one call to
 * the next unless its descriptor allows a single concurrent job.
 */
public interface EngineAdapter extends AutoCloseable {

    /**
     * Static descriptor, fixed at construction
     */
    EngineDescriptor descriptor();

    /**
     * Execute a query (blocking)
     *
     * @param queryText SQL text
     * @param token cancellation signal; once fired the adapter aborts and
     *              throws an {@link EngineException} of kind CANCELLED
     * @return engine-native result
     * @throws EngineException classified failure
     */
    RawResult execute(String queryText, CancellationToken token) throws EngineException;

    /**
     * Check a query without executing it (blocking). Rejection by the engine
     * is a normal, invalid outcome.
     *
     * @param queryText SQL text
     * @return the verdict, with the plan when the engine produced one
     * @throws EngineException if the engine could not be reached
     */
    QueryValidation validate(String queryText) throws EngineException;

    /**
     * Check the engine is reachable
     */
    boolean ping();

    /**
     * Release connections
     */
    @Override
    default void close() {
        // Default: nothing to release
    }
}
