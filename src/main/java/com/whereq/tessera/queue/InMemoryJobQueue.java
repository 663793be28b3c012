package com.whereq.tessera.queue;

import com.whereq.tessera.model.Job;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job queue backed by a unicast sink.
 *
 * <p>The sink buffers jobs until the consumer requests them, so a job counts
 * as dequeued only once the dispatcher has a free slot for it.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class InMemoryJobQueue implements JobQueue {

    private final String engineId;
    private final Sinks.Many<Job> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    public InMemoryJobQueue(String engineId) {
        this.engineId = engineId;
    }

    @Override
    public String getEngineId() {
        return engineId;
    }

    @Override
    public Mono<Void> enqueue(Job job) {
        return Mono.fromRunnable(() -> {
            // emission is serialized so the buffer order is the submission order
            synchronized (sink) {
                pending.add(job.getId());
                sink.emitNext(job, Sinks.EmitFailureHandler.FAIL_FAST);
            }
            log.debug("Job {} enqueued on {} ({} waiting)", job.getId(), engineId, pending.size());
        });
    }

    @Override
    public Flux<Job> consumeAsFlux() {
        return sink.asFlux()
            .filter(job -> {
                boolean waiting = pending.remove(job.getId());
                if (!waiting) {
                    log.debug("Skipping job {} removed from {} queue", job.getId(), engineId);
                }
                return waiting;
            });
    }

    @Override
    public Mono<Boolean> remove(String jobId) {
        return Mono.fromCallable(() -> pending.remove(jobId));
    }

    @Override
    public Mono<Long> size() {
        return Mono.fromCallable(this::pendingCount);
    }

    public long pendingCount() {
        return pending.size();
    }

    /**
     * Stop emitting; the consumer completes after draining nothing further
     */
    public void close() {
        synchronized (sink) {
            sink.tryEmitComplete();
        }
    }
}
