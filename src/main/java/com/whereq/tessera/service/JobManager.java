package com.whereq.tessera.service;

import com.whereq.tessera.config.TesseraProperties;
import com.whereq.tessera.dto.EngineStatus;
import com.whereq.tessera.dto.SystemStatusResponse;
import com.whereq.tessera.engine.CancellationToken;
import com.whereq.tessera.engine.EngineAdapter;
import com.whereq.tessera.engine.EngineRegistry;
import com.whereq.tessera.exception.NotFoundException;
import com.whereq.tessera.exception.NotReadyException;
import com.whereq.tessera.model.ErrorKind;
import com.whereq.tessera.model.Job;
import com.whereq.tessera.model.JobError;
import com.whereq.tessera.model.JobState;
import com.whereq.tessera.normalizer.ResultNormalizer;
import com.whereq.tessera.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Orchestration core: accepts submissions, dispatches them to the engine
 * worker pools, and serves status, result and cancel requests.
 *
 * <p>Jobs that are not yet persisted in a terminal state live in an
 * in-memory handle map; reads prefer the handle so a caller never sees a
 * snapshot older than the latest transition.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManager implements EngineDispatcher.Listener {

    private final EngineRegistry engineRegistry;
    private final JobStore jobStore;
    private final ResultNormalizer normalizer;
    private final AdmissionController admissionController;
    private final TesseraProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, JobHandle> live = new ConcurrentHashMap<>();
    private final Map<String, EngineDispatcher> dispatchers = new LinkedHashMap<>();

    @PostConstruct
    public void start() {
        reconcile().block();

        Duration executionTimeout = properties.getJobs().getExecutionTimeout();
        for (EngineAdapter adapter : engineRegistry.all()) {
            EngineDispatcher dispatcher = new EngineDispatcher(adapter, normalizer, this, clock, executionTimeout);
            dispatchers.put(dispatcher.engineId(), dispatcher);

            Gauge.builder("tessera.queue.size", dispatcher.queue(), q -> q.pendingCount())
                .description("Jobs waiting for a worker")
                .tag("engine", dispatcher.engineId())
                .register(meterRegistry);
            Gauge.builder("tessera.jobs.running", dispatcher, EngineDispatcher::runningCount)
                .description("Jobs executing on the engine")
                .tag("engine", dispatcher.engineId())
                .register(meterRegistry);

            dispatcher.start();
        }
        log.info("Job manager started with engines {}", dispatchers.keySet());
    }

    @PreDestroy
    public void stop() {
        dispatchers.values().forEach(EngineDispatcher::stop);
    }

    /**
     * Submit a query for asynchronous execution
     *
     * @param queryText SQL text
     * @param engineId canonical engine id or alias
     * @return Mono with the QUEUED job, emitted once the job is stored and enqueued
     */
    public Mono<Job> submit(String queryText, String engineId) {
        return Mono.defer(() -> {
            if (queryText == null || queryText.isBlank()) {
                return Mono.error(new IllegalArgumentException("queryText must not be blank"));
            }
            EngineAdapter adapter = engineRegistry.resolve(engineId);
            EngineDispatcher dispatcher = dispatchers.get(adapter.descriptor().getEngineId());

            return admissionController.admit(dispatcher.queue())
                .then(Mono.defer(() -> {
                    Job job = Job.queued("job-" + UUID.randomUUID(), dispatcher.engineId(), queryText, clock.instant());
                    live.put(job.getId(), new JobHandle(job));

                    return jobStore.save(job)
                        .then(dispatcher.queue().enqueue(job))
                        .doOnSuccess(v -> {
                            counter("tessera.jobs.submitted", dispatcher.engineId()).increment();
                            log.info("Job {} submitted to {}", job.getId(), dispatcher.engineId());
                        })
                        .doOnError(e -> live.remove(job.getId()))
                        .thenReturn(job);
                }));
        });
    }

    /**
     * Current snapshot of a job
     *
     * @throws NotFoundException (as error signal) if the job is unknown
     */
    public Mono<Job> getStatus(String jobId) {
        return Mono.defer(() -> {
            JobHandle handle = live.get(jobId);
            if (handle != null) {
                return Mono.just(handle.snapshot());
            }
            return jobStore.findById(jobId)
                .switchIfEmpty(Mono.error(() -> NotFoundException.job(jobId)));
        });
    }

    /**
     * Terminal snapshot of a job, carrying its result or error
     *
     * @throws NotReadyException (as error signal) if the job is still QUEUED or RUNNING
     */
    public Mono<Job> getResult(String jobId) {
        return getStatus(jobId)
            .flatMap(job -> job.getState().isTerminal()
                ? Mono.just(job)
                : Mono.error(new NotReadyException(jobId, job.getState())));
    }

    /**
     * Cancel a job. Idempotent: a terminal job is returned unchanged.
     *
     * @return Mono with the snapshot after cancellation
     */
    public Mono<Job> cancel(String jobId) {
        return Mono.defer(() -> {
            JobHandle handle = live.get(jobId);
            if (handle == null) {
                return jobStore.findById(jobId)
                    .switchIfEmpty(Mono.error(() -> NotFoundException.job(jobId)))
                    .flatMap(this::cancelDetached);
            }

            Job snapshot = handle.snapshot();
            if (snapshot.getState().isTerminal()) {
                return Mono.just(snapshot);
            }

            if (handle.cancelIfQueued(clock.instant())) {
                log.info("Job {} cancelled before execution", jobId);
                EngineDispatcher dispatcher = dispatchers.get(snapshot.getEngineId());
                return dispatcher.queue().remove(jobId)
                    .then(complete(handle));
            }

            return cancelRunning(handle);
        });
    }

    /**
     * Job snapshots, newest first
     *
     * @param state optional state filter
     * @param engineId optional engine filter (id or alias)
     * @param limit maximum number of jobs
     */
    public Flux<Job> listJobs(JobState state, String engineId, int limit) {
        return Flux.defer(() -> {
            String canonical = engineId == null ? null : engineRegistry.resolve(engineId).descriptor().getEngineId();
            return jobStore.findAll()
                .map(job -> {
                    JobHandle handle = live.get(job.getId());
                    return handle != null ? handle.snapshot() : job;
                })
                .filter(job -> state == null || job.getState() == state)
                .filter(job -> canonical == null || canonical.equals(job.getEngineId()))
                .sort(Comparator.comparing(Job::getSubmittedAt).reversed())
                .take(limit);
        });
    }

    /**
     * Per-engine queue, worker and reachability figures plus job counts per state
     */
    public Mono<SystemStatusResponse> systemStatus() {
        Mono<Map<JobState, Long>> counts = listJobs(null, null, Integer.MAX_VALUE)
            .collect(() -> {
                Map<JobState, Long> byState = new EnumMap<>(JobState.class);
                for (JobState s : JobState.values()) {
                    byState.put(s, 0L);
                }
                return byState;
            }, (byState, job) -> byState.merge(job.getState(), 1L, Long::sum));

        Mono<List<EngineStatus>> engines = Flux.fromIterable(dispatchers.values())
            .flatMapSequential(dispatcher -> Mono.fromCallable(() -> dispatcher.adapter().ping())
                .subscribeOn(Schedulers.boundedElastic())
                .map(reachable -> EngineStatus.builder()
                    .engineId(dispatcher.engineId())
                    .aliases(dispatcher.adapter().descriptor().getAliases())
                    .maxConcurrency(dispatcher.adapter().descriptor().getMaxConcurrency())
                    .capabilities(dispatcher.adapter().descriptor().getCapabilities())
                    .queued(dispatcher.queue().pendingCount())
                    .running(dispatcher.runningCount())
                    .reachable(reachable)
                    .build()))
            .collectList();

        return Mono.zip(engines, counts)
            .map(tuple -> SystemStatusResponse.builder()
                .engines(tuple.getT1())
                .jobCounts(tuple.getT2())
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Fail jobs left QUEUED or RUNNING by a previous process
     */
    Mono<Long> reconcile() {
        Instant now = clock.instant();
        return jobStore.findAll()
            .filter(job -> !job.getState().isTerminal())
            .flatMap(job -> {
                log.warn("Job {} was {} when the previous process stopped, marking FAILED", job.getId(), job.getState());
                return jobStore.save(job.failed(JobError.of(ErrorKind.INTERRUPTED,
                    "Job was " + job.getState() + " when the service stopped"), now));
            })
            .count()
            .doOnNext(count -> {
                if (count > 0) {
                    log.info("Reconciled {} interrupted job(s)", count);
                }
            });
    }

    @Scheduled(fixedDelayString = "${tessera.store.eviction-interval:PT10M}")
    public void evictExpired() {
        Instant cutoff = clock.instant().minus(properties.getStore().getRetention());
        jobStore.deleteFinishedBefore(cutoff)
            .subscribe(
                removed -> {
                    if (removed > 0) {
                        log.info("Evicted {} job(s) finished before {}", removed, cutoff);
                    }
                },
                e -> log.error("Job eviction failed", e));
    }

    @Override
    public JobHandle handle(String jobId) {
        return live.get(jobId);
    }

    @Override
    public void started(JobHandle handle) {
        jobStore.save(handle.snapshot())
            .doOnError(e -> log.error("Failed to persist RUNNING state of job {}", handle.id(), e))
            .onErrorResume(e -> Mono.empty())
            .block();
    }

    @Override
    public void finished(JobHandle handle, Duration executionTime) {
        Job job = handle.snapshot();
        Timer.builder("tessera.jobs.execution.time")
            .description("Job execution time")
            .tag("engine", job.getEngineId())
            .register(meterRegistry)
            .record(executionTime);
        complete(handle)
            .doOnError(e -> log.error("Failed to persist final state of job {}", handle.id(), e))
            .onErrorResume(e -> Mono.empty())
            .block();
    }

    private Mono<Job> cancelRunning(JobHandle handle) {
        String jobId = handle.id();
        Duration grace = properties.getJobs().getCancelGracePeriod();
        handle.token().cancel(CancellationToken.Reason.USER);
        log.info("Cancellation signalled to running job {}", jobId);

        return Mono.fromFuture(handle.terminal().copy())
            .timeout(grace)
            .onErrorResume(TimeoutException.class, e -> {
                if (handle.cancel(clock.instant())) {
                    log.warn("Job {} did not stop within {}; marked CANCELLED, but engine {} may still hold "
                        + "its connection until the engine abandons the query", jobId, grace, handle.snapshot().getEngineId());
                    return complete(handle);
                }
                return Mono.just(handle.snapshot());
            });
    }

    private Mono<Job> cancelDetached(Job job) {
        if (job.getState().isTerminal()) {
            return Mono.just(job);
        }
        // stored as active but owned by no worker in this process
        log.warn("Job {} is {} without a live worker, marking CANCELLED", job.getId(), job.getState());
        return jobStore.save(job.cancelled(clock.instant()));
    }

    /**
     * Persist the terminal snapshot, then drop the live handle
     */
    private Mono<Job> complete(JobHandle handle) {
        Job job = handle.snapshot();
        return jobStore.save(job)
            .doOnSuccess(saved -> {
                if (live.remove(job.getId(), handle)) {
                    counter(outcomeMetric(job.getState()), job.getEngineId()).increment();
                }
            })
            .thenReturn(job);
    }

    private static String outcomeMetric(JobState state) {
        return switch (state) {
            case SUCCEEDED -> "tessera.jobs.succeeded";
            case CANCELLED -> "tessera.jobs.cancelled";
            default -> "tessera.jobs.failed";
        };
    }

    private Counter counter(String name, String engineId) {
        return Counter.builder(name)
            .tag("engine", engineId)
            .register(meterRegistry);
    }
}
