package com.whereq.tessera.service;

import com.whereq.tessera.engine.CancellationToken;
import com.whereq.tessera.engine.EngineAdapter;
import com.whereq.tessera.engine.EngineException;
import com.whereq.tessera.engine.RawResult;
import com.whereq.tessera.model.ErrorKind;
import com.whereq.tessera.model.Job;
import com.whereq.tessera.model.JobError;
import com.whereq.tessera.normalizer.ResultNormalizer;
import com.whereq.tessera.queue.InMemoryJobQueue;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool for one engine.
 *
 * <p>Consumes the engine queue in FIFO order with at most
 * {@code maxConcurrency} jobs in flight, the width read from the adapter
 * descriptor. A job moves to RUNNING when it is dequeued, then executes on a
 * dedicated bounded-elastic scheduler; every adapter failure is classified
 * and stored on the job, so one bad query never stops the loop.
 *
 * @author WhereQ Inc.
 */
@Slf4j
class EngineDispatcher {

    private final EngineAdapter adapter;
    private final InMemoryJobQueue queue;
    private final ResultNormalizer normalizer;
    private final Listener listener;
    private final Clock clock;
    private final Duration executionTimeout;
    private final int maxConcurrency;
    private final Scheduler scheduler;
    private final AtomicInteger running = new AtomicInteger();
    private Disposable subscription;

    EngineDispatcher(EngineAdapter adapter, ResultNormalizer normalizer, Listener listener,
                     Clock clock, Duration executionTimeout) {
        this.adapter = adapter;
        this.normalizer = normalizer;
        this.listener = listener;
        this.clock = clock;
        this.executionTimeout = executionTimeout;
        this.maxConcurrency = Math.max(1, adapter.descriptor().getMaxConcurrency());
        this.queue = new InMemoryJobQueue(engineId());
        this.scheduler = Schedulers.newBoundedElastic(maxConcurrency, Integer.MAX_VALUE, "tessera-" + engineId());
    }

    String engineId() {
        return adapter.descriptor().getEngineId();
    }

    EngineAdapter adapter() {
        return adapter;
    }

    InMemoryJobQueue queue() {
        return queue;
    }

    int runningCount() {
        return running.get();
    }

    void start() {
        log.info("Starting dispatcher for {} with {} worker(s)", engineId(), maxConcurrency);

        subscription = queue.consumeAsFlux()
            .flatMap(job -> dispatch(job)
                .onErrorResume(e -> {
                    log.error("Error processing job {}: {}", job.getId(), e.getMessage(), e);
                    return Mono.empty(); // Continue processing next job
                }), maxConcurrency)
            .subscribe(
                unused -> { },
                e -> log.error("Dispatcher for {} stopped on fatal error", engineId(), e));
    }

    void stop() {
        queue.close();
        if (subscription != null) {
            subscription.dispose();
        }
        scheduler.dispose();
        log.info("Stopped dispatcher for {}", engineId());
    }

    /**
     * Take ownership of a dequeued job. Runs on the dequeuing thread, in
     * queue order, so jobs start in submission order.
     */
    private Mono<Void> dispatch(Job queued) {
        JobHandle handle = listener.handle(queued.getId());
        if (handle == null || !handle.start(clock.instant())) {
            log.debug("Job {} no longer queued, skipping", queued.getId());
            return Mono.empty();
        }
        running.incrementAndGet();
        return Mono.<Void>fromRunnable(() -> execute(handle))
            .subscribeOn(scheduler)
            .doFinally(signal -> running.decrementAndGet());
    }

    private void execute(JobHandle handle) {
        Job job = handle.snapshot();
        CancellationToken token = handle.token();
        log.info("Starting execution of job {} on {}", job.getId(), engineId());
        listener.started(handle);

        Disposable timer = Schedulers.parallel().schedule(() -> {
            if (token.cancel(CancellationToken.Reason.TIMEOUT)) {
                log.warn("Job {} exceeded execution timeout of {}", job.getId(), executionTimeout);
            }
        }, executionTimeout.toMillis(), TimeUnit.MILLISECONDS);

        long startTime = System.currentTimeMillis();
        try {
            RawResult raw = adapter.execute(job.getQueryText(), token);
            if (token.isCancelled()) {
                finishCancelled(handle);
            } else if (!handle.succeed(normalizer.normalize(raw), clock.instant())) {
                log.warn("Job {} already finished as {}, result discarded", job.getId(), handle.snapshot().getState());
            }
        } catch (EngineException e) {
            if (e.getKind() == ErrorKind.CANCELLED || token.isCancelled()) {
                finishCancelled(handle);
            } else {
                log.error("Job {} failed on {}: [{}] {}", job.getId(), engineId(), e.getKind(), e.getMessage());
                handle.fail(JobError.of(e.getKind(), e.getMessage()), clock.instant());
            }
        } catch (Throwable e) {
            // errors from drivers and native loaders end the job, never the worker
            log.error("Unexpected error executing job {}", job.getId(), e);
            if (token.isCancelled()) {
                finishCancelled(handle);
            } else {
                handle.fail(JobError.of(ErrorKind.ADAPTER_FAILURE, e.getClass().getSimpleName() + ": " + e.getMessage()),
                    clock.instant());
            }
        } finally {
            timer.dispose();
            long executionTime = System.currentTimeMillis() - startTime;
            log.info("Job {} finished as {} in {}ms", job.getId(), handle.snapshot().getState(), executionTime);
            listener.finished(handle, Duration.ofMillis(executionTime));
        }
    }

    private void finishCancelled(JobHandle handle) {
        if (handle.token().getReason() == CancellationToken.Reason.TIMEOUT) {
            handle.fail(JobError.of(ErrorKind.TIMEOUT,
                "Execution exceeded the timeout of " + executionTimeout), clock.instant());
        } else {
            handle.cancel(clock.instant());
        }
    }

    /**
     * Callbacks into the owning job manager
     */
    interface Listener {
        /**
         * Live handle of a job, or null if it is gone
         */
        JobHandle handle(String jobId);

        void started(JobHandle handle);

        /**
         * Called once the worker is done with the job, whatever its outcome
         */
        void finished(JobHandle handle, Duration executionTime);
    }
}
