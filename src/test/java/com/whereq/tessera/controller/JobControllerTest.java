package com.whereq.tessera.controller;

import com.whereq.tessera.dto.JobStatusResponse;
import com.whereq.tessera.dto.JobSubmitRequest;
import com.whereq.tessera.dto.JobSubmitResponse;
import com.whereq.tessera.model.JobState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end job flow against the embedded DuckDB engine
 */
@SpringBootTest
@AutoConfigureWebTestClient(timeout = "PT30S")
class JobControllerTest {

    @Autowired
    private WebTestClient client;

    private JobSubmitResponse submit(String sql, String engineId) {
        return client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(JobSubmitRequest.builder().queryText(sql).engineId(engineId).build())
            .exchange()
            .expectStatus().isAccepted()
            .expectBody(JobSubmitResponse.class)
            .returnResult()
            .getResponseBody();
    }

    private JobStatusResponse awaitState(String jobId, JobState state) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(20).toNanos();
        while (true) {
            JobStatusResponse status = client.get().uri("/api/v1/jobs/{id}", jobId)
                .exchange()
                .expectStatus().isOk()
                .expectBody(JobStatusResponse.class)
                .returnResult()
                .getResponseBody();
            if (status.getStatus() == state) {
                return status;
            }
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Job " + jobId + " stuck in " + status.getStatus() + ", expected " + state);
            }
            Thread.sleep(20);
        }
    }

    @Test
    void selectOneOnEmbeddedEngineReturnsOneRow() throws InterruptedException {
        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("queryText", "SELECT 1 AS n", "engineId", "embedded"))
            .exchange()
            .expectStatus().isAccepted()
            .expectHeader().valueMatches("Location", "/api/v1/jobs/job-.+")
            .expectBody()
            .jsonPath("$.jobId").isNotEmpty()
            .jsonPath("$.engineId").isEqualTo("duckdb")
            .jsonPath("$.status").isEqualTo("QUEUED");

        JobSubmitResponse submitted = submit("SELECT 1 AS n", "embedded");
        JobStatusResponse done = awaitState(submitted.getJobId(), JobState.SUCCEEDED);
        assertThat(done.getStartedAt()).isNotNull();
        assertThat(done.getFinishedAt()).isNotNull();

        client.get().uri("/api/v1/jobs/{id}/result", submitted.getJobId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("SUCCEEDED")
            .jsonPath("$.columns[0].name").isEqualTo("n")
            .jsonPath("$.columns[0].type").isEqualTo("INTEGER")
            .jsonPath("$.rows.length()").isEqualTo(1)
            .jsonPath("$.rows[0][0]").isEqualTo(1)
            .jsonPath("$.stats.rowsReturned").isEqualTo(1)
            .jsonPath("$.errorKind").doesNotExist();
    }

    @Test
    void failingQueryIsReportedWithItsKind() throws InterruptedException {
        JobSubmitResponse submitted = submit("SELECT * FROM table_that_does_not_exist", "duckdb");

        JobStatusResponse failed = awaitState(submitted.getJobId(), JobState.FAILED);

        assertThat(failed.getErrorKind()).hasToString("ADAPTER_FAILURE");
        client.get().uri("/api/v1/jobs/{id}/result", submitted.getJobId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("FAILED")
            .jsonPath("$.errorKind").isEqualTo("ADAPTER_FAILURE")
            .jsonPath("$.rows").doesNotExist();
    }

    @Test
    void runningJobHasNoResultYetAndCanBeCancelled() throws InterruptedException {
        JobSubmitResponse submitted = submit(
            "SELECT sum(a.range * b.range) FROM range(100000000) a, range(100000) b", "embedded");
        awaitState(submitted.getJobId(), JobState.RUNNING);

        client.get().uri("/api/v1/jobs/{id}/result", submitted.getJobId())
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.errorKind").isEqualTo("NOT_READY")
            .jsonPath("$.status").isEqualTo("RUNNING");

        client.post().uri("/api/v1/jobs/{id}/cancel", submitted.getJobId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("CANCELLED");

        // cancelling again leaves the job as it is
        client.post().uri("/api/v1/jobs/{id}/cancel", submitted.getJobId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("CANCELLED");
    }

    @Test
    void unknownEngineIsBadRequest() {
        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("queryText", "SELECT 1", "engineId", "snowflake"))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.errorMessage").isEqualTo("Unknown engine: snowflake");
    }

    @Test
    void missingFieldsAreBadRequest() {
        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("queryText", "SELECT 1"))
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    void unknownJobIsNotFound() {
        client.get().uri("/api/v1/jobs/job-unknown")
            .exchange()
            .expectStatus().isNotFound();
        client.get().uri("/api/v1/jobs/job-unknown/result")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.errorKind").isEqualTo("NOT_FOUND");
        client.post().uri("/api/v1/jobs/job-unknown/cancel")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void listsSubmittedJobs() throws InterruptedException {
        JobSubmitResponse submitted = submit("SELECT 42 AS answer", "duckdb");
        awaitState(submitted.getJobId(), JobState.SUCCEEDED);

        client.get().uri(uri -> uri.path("/api/v1/jobs")
                .queryParam("state", "SUCCEEDED")
                .queryParam("engineId", "embedded")
                .build())
            .exchange()
            .expectStatus().isOk()
            .expectBodyList(JobStatusResponse.class)
            .value(jobs -> assertThat(jobs)
                .extracting(JobStatusResponse::getJobId)
                .contains(submitted.getJobId()));
    }

    @Test
    void engineStatusListsEmbeddedEngine() {
        client.get().uri("/api/v1/engines")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.engines.length()").isEqualTo(1)
            .jsonPath("$.engines[0].engineId").isEqualTo("duckdb")
            .jsonPath("$.engines[0].maxConcurrency").isEqualTo(1)
            .jsonPath("$.engines[0].reachable").isEqualTo(true)
            .jsonPath("$.jobCounts").exists();
    }
}
