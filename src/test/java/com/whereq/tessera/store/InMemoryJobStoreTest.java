package com.whereq.tessera.store;

import com.whereq.tessera.model.ErrorKind;
import com.whereq.tessera.model.Job;
import com.whereq.tessera.model.JobError;
import com.whereq.tessera.model.JobState;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryJobStoreTest {

    private static final Instant T0 = Instant.parse("2026-06-01T00:00:00Z");

    private final InMemoryJobStore store = new InMemoryJobStore();

    @Test
    void savesAndFindsLatestSnapshot() {
        Job queued = Job.queued("job-1", "duckdb", "SELECT 1", T0);
        Job running = queued.started(T0.plusSeconds(1));

        store.save(queued).block();
        store.save(running).block();

        StepVerifier.create(store.findById("job-1"))
            .assertNext(job -> assertThat(job.getState()).isEqualTo(JobState.RUNNING))
            .verifyComplete();
        StepVerifier.create(store.findById("job-2")).verifyComplete();
    }

    @Test
    void terminalSnapshotIsNeverReplacedByActiveOne() {
        Job queued = Job.queued("job-1", "duckdb", "SELECT 1", T0);
        Job cancelled = queued.cancelled(T0.plusSeconds(1));
        store.save(cancelled).block();

        StepVerifier.create(store.save(queued.started(T0.plusSeconds(2))))
            .assertNext(job -> assertThat(job.getState()).isEqualTo(JobState.CANCELLED))
            .verifyComplete();
        assertThat(store.findById("job-1").block().getState()).isEqualTo(JobState.CANCELLED);
    }

    @Test
    void evictsOnlyTerminalJobsFinishedBeforeCutoff() {
        Job old = Job.queued("old", "duckdb", "SELECT 1", T0)
            .failed(JobError.of(ErrorKind.ADAPTER_FAILURE, "boom"), T0.plusSeconds(1));
        Job recent = Job.queued("recent", "duckdb", "SELECT 1", T0)
            .cancelled(T0.plus(Duration.ofDays(2)));
        Job active = Job.queued("active", "duckdb", "SELECT 1", T0);
        store.save(old).block();
        store.save(recent).block();
        store.save(active).block();

        StepVerifier.create(store.deleteFinishedBefore(T0.plus(Duration.ofDays(1))))
            .expectNext(1L)
            .verifyComplete();
        StepVerifier.create(store.findAll().map(Job::getId).sort())
            .expectNext("active", "recent")
            .verifyComplete();
    }
}
