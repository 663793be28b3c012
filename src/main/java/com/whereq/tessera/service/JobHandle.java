package com.whereq.tessera.service;

import com.whereq.tessera.engine.CancellationToken;
import com.whereq.tessera.model.Job;
import com.whereq.tessera.model.JobError;
import com.whereq.tessera.model.JobState;
import com.whereq.tessera.model.QueryResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Live state of a job that has not been persisted in a terminal state yet.
 *
 * <p>Every transition is a compare-and-set on the current snapshot, so
 * readers always see a consistent snapshot and at most one caller wins a
 * race to a terminal state.
 */
class JobHandle {

    private final AtomicReference<Job> current;
    private final CancellationToken token = new CancellationToken();
    private final CompletableFuture<Job> terminal = new CompletableFuture<>();

    JobHandle(Job job) {
        this.current = new AtomicReference<>(job);
    }

    Job snapshot() {
        return current.get();
    }

    String id() {
        return current.get().getId();
    }

    CancellationToken token() {
        return token;
    }

    /**
     * Completes with the terminal snapshot
     */
    CompletableFuture<Job> terminal() {
        return terminal;
    }

    boolean start(Instant now) {
        return transition(JobState.RUNNING, job -> job.started(now));
    }

    boolean succeed(QueryResult result, Instant now) {
        return transition(JobState.SUCCEEDED, job -> job.succeeded(result, now));
    }

    boolean fail(JobError error, Instant now) {
        return transition(JobState.FAILED, job -> job.failed(error, now));
    }

    boolean cancel(Instant now) {
        return transition(JobState.CANCELLED, job -> job.cancelled(now));
    }

    /**
     * Cancel only if no worker has taken the job yet
     */
    boolean cancelIfQueued(Instant now) {
        Job job = current.get();
        while (job.getState() == JobState.QUEUED) {
            Job next = job.cancelled(now);
            if (current.compareAndSet(job, next)) {
                terminal.complete(next);
                return true;
            }
            job = current.get();
        }
        return false;
    }

    private boolean transition(JobState target, UnaryOperator<Job> change) {
        while (true) {
            Job job = current.get();
            if (!job.getState().canTransitionTo(target)) {
                return false;
            }
            Job next = change.apply(job);
            if (current.compareAndSet(job, next)) {
                if (target.isTerminal()) {
                    terminal.complete(next);
                }
                return true;
            }
        }
    }
}
