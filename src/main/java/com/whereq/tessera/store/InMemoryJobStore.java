package com.whereq.tessera.store;

import com.whereq.tessera.model.Job;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Job snapshots kept in process memory
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "tessera.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public Mono<Job> save(Job job) {
        return Mono.fromCallable(() -> jobs.merge(job.getId(), job,
            (existing, incoming) -> existing.getState().isTerminal() && !incoming.getState().isTerminal()
                ? existing
                : incoming));
    }

    @Override
    public Mono<Job> findById(String jobId) {
        return Mono.justOrEmpty(jobs.get(jobId));
    }

    @Override
    public Flux<Job> findAll() {
        return Flux.fromIterable(jobs.values());
    }

    @Override
    public Mono<Long> deleteFinishedBefore(Instant cutoff) {
        return Mono.fromCallable(() -> {
            AtomicLong removed = new AtomicLong();
            jobs.values().removeIf(job -> {
                boolean expired = job.getState().isTerminal()
                    && job.getFinishedAt() != null
                    && job.getFinishedAt().isBefore(cutoff);
                if (expired) {
                    removed.incrementAndGet();
                }
                return expired;
            });
            return removed.get();
        });
    }
}
