package com.whereq.tessera.store;

import com.whereq.tessera.model.Job;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Persistence of job snapshots
 */
public interface JobStore {

    /**
     * Store a snapshot. A stored terminal snapshot is never replaced by a
     * non-terminal one.
     *
     * @return the snapshot now stored for the job
     */
    Mono<Job> save(Job job);

    Mono<Job> findById(String jobId);

    Flux<Job> findAll();

    /**
     * Remove terminal jobs finished before the cutoff
     *
     * @return number of removed jobs
     */
    Mono<Long> deleteFinishedBefore(Instant cutoff);
}
