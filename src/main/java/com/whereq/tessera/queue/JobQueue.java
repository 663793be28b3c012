package com.whereq.tessera.queue;

import com.whereq.tessera.model.Job;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * FIFO queue of submitted jobs for one engine
 */
public interface JobQueue {

    /**
     * Engine whose jobs this queue holds
     */
    String getEngineId();

    /**
     * Enqueue a job
     *
     * @param job the QUEUED snapshot
     * @return Mono that completes when job is enqueued
     */
    Mono<Void> enqueue(Job job);

    /**
     * Consume jobs in submission order. Only one subscriber is allowed;
     * removed jobs are never emitted.
     *
     * @return Flux of queued jobs
     */
    Flux<Job> consumeAsFlux();

    /**
     * Remove a job that has not been consumed yet (for cancellation)
     *
     * @param jobId the job identifier
     * @return Mono with true if the job was still waiting
     */
    Mono<Boolean> remove(String jobId);

    /**
     * Get current queue size
     *
     * @return Mono with queue size
     */
    Mono<Long> size();

    /**
     * Check if queue is full
     *
     * @param maxSize maximum allowed size
     * @return Mono with true if queue is full
     */
    default Mono<Boolean> isFull(long maxSize) {
        return size().map(s -> s >= maxSize);
    }
}
