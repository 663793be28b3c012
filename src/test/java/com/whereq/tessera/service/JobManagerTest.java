package com.whereq.tessera.service;

import com.whereq.tessera.config.TesseraProperties;
import com.whereq.tessera.dto.SystemStatusResponse;
import com.whereq.tessera.engine.EngineAdapter;
import com.whereq.tessera.engine.EngineRegistry;
import com.whereq.tessera.exception.NotFoundException;
import com.whereq.tessera.exception.NotReadyException;
import com.whereq.tessera.exception.QuotaExceededException;
import com.whereq.tessera.exception.UnknownEngineException;
import com.whereq.tessera.model.ColumnType;
import com.whereq.tessera.model.ErrorKind;
import com.whereq.tessera.model.Job;
import com.whereq.tessera.model.JobState;
import com.whereq.tessera.normalizer.ResultNormalizer;
import com.whereq.tessera.store.InMemoryJobStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class JobManagerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private FakeEngineAdapter embedded;
    private FakeEngineAdapter distributed;
    private InMemoryJobStore store;
    private TesseraProperties properties;
    private MeterRegistry meterRegistry;
    private JobManager manager;

    @BeforeEach
    void setUp() {
        embedded = new FakeEngineAdapter("duckdb", "embedded", 1);
        distributed = new FakeEngineAdapter("clickhouse", "distributed", 2);
        store = new InMemoryJobStore();
        properties = new TesseraProperties();
        properties.getJobs().setMaxQueueSize(100);
        properties.getJobs().setCancelGracePeriod(Duration.ofSeconds(2));
        properties.getJobs().setExecutionTimeout(Duration.ofMinutes(1));
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        embedded.release();
        distributed.release();
        if (manager != null) {
            manager.stop();
        }
    }

    private JobManager start() {
        List<EngineAdapter> adapters = List.of(embedded, distributed);
        manager = new JobManager(new EngineRegistry(adapters), store, new ResultNormalizer(),
            new AdmissionController(properties, meterRegistry), properties, meterRegistry, new TickingClock());
        manager.start();
        return manager;
    }

    private Job submit(String sql, String engineId) {
        return manager.submit(sql, engineId).block(WAIT);
    }

    private Job awaitState(String jobId, JobState state) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        Job job = manager.getStatus(jobId).block(WAIT);
        while (job.getState() != state) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Job " + jobId + " stuck in " + job.getState() + ", expected " + state);
            }
            Thread.sleep(10);
            job = manager.getStatus(jobId).block(WAIT);
        }
        return job;
    }

    private void awaitCount(String counter, String engineId, double expected) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (meterRegistry.counter(counter, "engine", engineId).count() < expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError(counter + " for " + engineId + " never reached " + expected);
            }
            Thread.sleep(10);
        }
        assertThat(meterRegistry.counter(counter, "engine", engineId).count()).isEqualTo(expected);
    }

    @Test
    void selectOneRunsToSucceededWithNormalizedResult() throws InterruptedException {
        start();

        Job queued = submit("SELECT 1", "embedded");
        assertThat(queued.getState()).isEqualTo(JobState.QUEUED);
        assertThat(queued.getEngineId()).isEqualTo("duckdb");
        assertThat(queued.getSubmittedAt()).isNotNull();

        Job done = awaitState(queued.getId(), JobState.SUCCEEDED);

        assertThat(done.getStartedAt()).isAfterOrEqualTo(done.getSubmittedAt());
        assertThat(done.getFinishedAt()).isAfterOrEqualTo(done.getStartedAt());
        assertThat(done.getError()).isNull();
        assertThat(done.getResult().getColumns()).extracting(c -> c.getType()).containsExactly(ColumnType.INTEGER);
        assertThat(done.getResult().getRows()).containsExactly(List.of(1L));
        assertThat(done.getResult().getStats().getRowsReturned()).isEqualTo(1);

        StepVerifier.create(manager.getResult(queued.getId()))
            .assertNext(job -> assertThat(job.getState()).isEqualTo(JobState.SUCCEEDED))
            .verifyComplete();
        awaitCount("tessera.jobs.succeeded", "duckdb", 1.0);
    }

    @Test
    void unknownEngineIsRejectedWithoutCreatingAJob() {
        start();

        StepVerifier.create(manager.submit("SELECT 1", "oracle"))
            .expectError(UnknownEngineException.class)
            .verify(WAIT);
        StepVerifier.create(manager.listJobs(null, null, 10))
            .verifyComplete();
    }

    @Test
    void blankQueryIsRejected() {
        start();

        StepVerifier.create(manager.submit("  ", "duckdb"))
            .expectError(IllegalArgumentException.class)
            .verify(WAIT);
    }

    @Test
    void unknownJobIsNotFound() {
        start();

        StepVerifier.create(manager.getStatus("job-missing")).expectError(NotFoundException.class).verify(WAIT);
        StepVerifier.create(manager.getResult("job-missing")).expectError(NotFoundException.class).verify(WAIT);
        StepVerifier.create(manager.cancel("job-missing")).expectError(NotFoundException.class).verify(WAIT);
    }

    @Test
    void resultOfUnfinishedJobIsNotReady() throws InterruptedException {
        start();
        Job job = submit("BLOCK", "duckdb");
        awaitState(job.getId(), JobState.RUNNING);

        StepVerifier.create(manager.getResult(job.getId()))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOfSatisfying(NotReadyException.class, n -> assertThat(n.getState()).isEqualTo(JobState.RUNNING)))
            .verify(WAIT);
    }

    @Test
    void cancelBeforeDequeueNeverReachesTheEngine() throws InterruptedException {
        start();
        Job blocker = submit("BLOCK first", "duckdb");
        awaitState(blocker.getId(), JobState.RUNNING);
        Job waiting = submit("SELECT 'second'", "duckdb");

        Job cancelled = manager.cancel(waiting.getId()).block(WAIT);
        embedded.release();
        awaitState(blocker.getId(), JobState.SUCCEEDED);
        Job third = submit("SELECT 'third'", "duckdb");
        awaitState(third.getId(), JobState.SUCCEEDED);

        assertThat(cancelled.getState()).isEqualTo(JobState.CANCELLED);
        assertThat(cancelled.getStartedAt()).isNull();
        assertThat(embedded.executed()).containsExactly("BLOCK first", "SELECT 'third'");
        assertThat(manager.getStatus(waiting.getId()).block(WAIT).getState()).isEqualTo(JobState.CANCELLED);
    }

    @Test
    void cancelWhileRunningStopsTheAdapter() throws InterruptedException {
        start();
        Job job = submit("BLOCK", "clickhouse");
        awaitState(job.getId(), JobState.RUNNING);

        Job cancelled = manager.cancel(job.getId()).block(WAIT);

        assertThat(cancelled.getState()).isEqualTo(JobState.CANCELLED);
        assertThat(cancelled.getFinishedAt()).isNotNull();
        assertThat(manager.getResult(job.getId()).block(WAIT).getState()).isEqualTo(JobState.CANCELLED);
        awaitCount("tessera.jobs.cancelled", "clickhouse", 1.0);
        assertThat(store.findById(job.getId()).block(WAIT).getState()).isEqualTo(JobState.CANCELLED);
    }

    @Test
    void unresponsiveJobIsMarkedCancelledAfterGracePeriod() throws InterruptedException {
        properties.getJobs().setCancelGracePeriod(Duration.ofMillis(200));
        start();
        Job job = submit("STUCK", "duckdb");
        awaitState(job.getId(), JobState.RUNNING);

        Job cancelled = manager.cancel(job.getId()).block(WAIT);
        assertThat(cancelled.getState()).isEqualTo(JobState.CANCELLED);

        // the worker eventually returns a result, which must not overwrite the cancellation
        embedded.release();
        Thread.sleep(200);
        Job after = manager.getStatus(job.getId()).block(WAIT);
        assertThat(after.getState()).isEqualTo(JobState.CANCELLED);
        assertThat(after.getResult()).isNull();
    }

    @Test
    void cancelIsIdempotent() throws InterruptedException {
        start();
        Job done = submit("SELECT 1", "duckdb");
        Job succeeded = awaitState(done.getId(), JobState.SUCCEEDED);

        assertThat(manager.cancel(done.getId()).block(WAIT)).isEqualTo(succeeded);

        Job blocker = submit("BLOCK", "duckdb");
        awaitState(blocker.getId(), JobState.RUNNING);
        Job first = manager.cancel(blocker.getId()).block(WAIT);
        Job second = manager.cancel(blocker.getId()).block(WAIT);

        assertThat(second).isEqualTo(first);
        awaitCount("tessera.jobs.cancelled", "duckdb", 1.0);
        assertThat(manager.cancel(blocker.getId()).block(WAIT)).isEqualTo(first);
    }

    @Test
    void singleConnectionEngineRunsJobsOneAtATimeInSubmissionOrder() throws InterruptedException {
        start();
        List<Job> jobs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            jobs.add(submit("SELECT " + i, "duckdb"));
        }

        for (Job job : jobs) {
            awaitState(job.getId(), JobState.SUCCEEDED);
        }

        assertThat(embedded.maxInFlight()).isEqualTo(1);
        assertThat(embedded.executed()).containsExactly("SELECT 0", "SELECT 1", "SELECT 2", "SELECT 3", "SELECT 4");
    }

    @Test
    void pooledEngineRunsUpToItsConcurrency() throws InterruptedException {
        start();
        Job a = submit("BLOCK a", "distributed");
        Job b = submit("BLOCK b", "distributed");
        Job c = submit("BLOCK c", "distributed");

        awaitState(a.getId(), JobState.RUNNING);
        awaitState(b.getId(), JobState.RUNNING);
        Thread.sleep(100);
        assertThat(manager.getStatus(c.getId()).block(WAIT).getState()).isEqualTo(JobState.QUEUED);

        distributed.release();
        awaitState(c.getId(), JobState.SUCCEEDED);
        assertThat(distributed.maxInFlight()).isEqualTo(2);
    }

    @Test
    void adapterErrorsAreClassifiedAndDoNotStopTheEngine() throws InterruptedException {
        start();
        Job broken = submit("FAIL", "duckdb");
        Job flaky = submit("TRANSIENT", "duckdb");
        Job fine = submit("SELECT 1", "duckdb");

        Job failed = awaitState(broken.getId(), JobState.FAILED);
        Job transientFailure = awaitState(flaky.getId(), JobState.FAILED);
        awaitState(fine.getId(), JobState.SUCCEEDED);

        assertThat(failed.getError().getKind()).isEqualTo(ErrorKind.ADAPTER_FAILURE);
        assertThat(failed.getError().getMessage()).contains("syntax error");
        assertThat(failed.getResult()).isNull();
        assertThat(transientFailure.getError().getKind()).isEqualTo(ErrorKind.TRANSIENT);
    }

    @Test
    void adapterThrowingAnErrorFailsTheJobAndKeepsTheEngineRunning() throws InterruptedException {
        start();
        Job crashed = submit("ERROR", "embedded");
        Job next = submit("SELECT 1", "embedded");

        Job failed = awaitState(crashed.getId(), JobState.FAILED);
        awaitState(next.getId(), JobState.SUCCEEDED);

        assertThat(failed.getError().getKind()).isEqualTo(ErrorKind.ADAPTER_FAILURE);
        assertThat(failed.getError().getMessage()).isEqualTo("AssertionError: driver bug");
        assertThat(failed.getFinishedAt()).isNotNull();
        awaitCount("tessera.jobs.failed", "duckdb", 1.0);
        StepVerifier.create(store.findById(crashed.getId()))
            .assertNext(job -> assertThat(job.getState()).isEqualTo(JobState.FAILED))
            .verifyComplete();
    }

    @Test
    void executionTimeoutFailsTheJob() throws InterruptedException {
        properties.getJobs().setExecutionTimeout(Duration.ofMillis(200));
        start();
        Job job = submit("BLOCK", "duckdb");

        Job failed = awaitState(job.getId(), JobState.FAILED);

        assertThat(failed.getError().getKind()).isEqualTo(ErrorKind.TIMEOUT);
    }

    @Test
    void fullQueueRejectsSubmission() throws InterruptedException {
        properties.getJobs().setMaxQueueSize(1);
        start();
        Job running = submit("BLOCK", "duckdb");
        awaitState(running.getId(), JobState.RUNNING);
        submit("SELECT 1", "duckdb");

        StepVerifier.create(manager.submit("SELECT 2", "duckdb"))
            .expectError(QuotaExceededException.class)
            .verify(WAIT);
        assertThat(meterRegistry.counter("tessera.admission.rejected", "engine", "duckdb").count()).isEqualTo(1.0);
    }

    @Test
    void jobsLeftActiveByAPreviousProcessAreFailedOnStartup() {
        Instant earlier = Instant.parse("2026-01-01T00:00:00Z");
        Job queued = Job.queued("job-old-1", "duckdb", "SELECT 1", earlier);
        Job running = Job.queued("job-old-2", "clickhouse", "SELECT 2", earlier).started(earlier);
        store.save(queued).block();
        store.save(running).block();

        start();

        for (String id : List.of("job-old-1", "job-old-2")) {
            Job job = manager.getStatus(id).block(WAIT);
            assertThat(job.getState()).isEqualTo(JobState.FAILED);
            assertThat(job.getError().getKind()).isEqualTo(ErrorKind.INTERRUPTED);
        }
    }

    @Test
    void listsJobsNewestFirstWithFilters() throws InterruptedException {
        start();
        Job first = submit("SELECT 1", "duckdb");
        Job second = submit("FAIL", "duckdb");
        Job third = submit("SELECT 3", "clickhouse");
        awaitState(first.getId(), JobState.SUCCEEDED);
        awaitState(second.getId(), JobState.FAILED);
        awaitState(third.getId(), JobState.SUCCEEDED);

        assertThat(manager.listJobs(null, null, 10).map(Job::getId).collectList().block(WAIT))
            .containsExactly(third.getId(), second.getId(), first.getId());
        assertThat(manager.listJobs(JobState.SUCCEEDED, "embedded", 10).map(Job::getId).collectList().block(WAIT))
            .containsExactly(first.getId());
        assertThat(manager.listJobs(null, null, 1).collectList().block(WAIT)).hasSize(1);
    }

    @Test
    void systemStatusReportsEnginesAndCounts() throws InterruptedException {
        start();
        Job job = submit("SELECT 1", "duckdb");
        awaitState(job.getId(), JobState.SUCCEEDED);

        SystemStatusResponse status = manager.systemStatus().block(WAIT);

        assertThat(status.getEngines())
            .extracting(e -> e.getEngineId())
            .containsExactly("duckdb", "clickhouse");
        assertThat(status.getEngines()).allSatisfy(e -> assertThat(e.isReachable()).isTrue());
        assertThat(status.getJobCounts()).containsEntry(JobState.SUCCEEDED, 1L).containsEntry(JobState.QUEUED, 0L);
    }

    /**
     * Advances one millisecond per reading so submission order is visible in timestamps
     */
    private static final class TickingClock extends Clock {
        private final AtomicLong millis = new AtomicLong(Instant.parse("2026-06-01T00:00:00Z").toEpochMilli());

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis.incrementAndGet());
        }
    }
}
