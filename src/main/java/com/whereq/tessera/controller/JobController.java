package com.whereq.tessera.controller;

import com.whereq.tessera.dto.JobCancellationResponse;
import com.whereq.tessera.dto.JobResultResponse;
import com.whereq.tessera.dto.JobStatusResponse;
import com.whereq.tessera.dto.JobSubmitRequest;
import com.whereq.tessera.dto.JobSubmitResponse;
import com.whereq.tessera.exception.NotFoundException;
import com.whereq.tessera.exception.NotReadyException;
import com.whereq.tessera.exception.QuotaExceededException;
import com.whereq.tessera.exception.UnknownEngineException;
import com.whereq.tessera.model.ErrorKind;
import com.whereq.tessera.model.JobState;
import com.whereq.tessera.service.JobManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Controller for asynchronous query jobs
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "Submit, poll and cancel query jobs")
public class JobController {

    @Autowired
    private JobManager jobManager;

    @PostMapping
    @Operation(summary = "Submit a query", description = "Queue SQL for execution on an engine; returns immediately")
    public Mono<ResponseEntity<JobSubmitResponse>> submitJob(@Valid @RequestBody JobSubmitRequest request) {
        log.info("Received job submission for engine {}", request.getEngineId());

        return jobManager.submit(request.getQueryText(), request.getEngineId())
            .map(job -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + job.getId()))
                .body(JobSubmitResponse.from(job)))
            .onErrorResume(UnknownEngineException.class, e -> {
                log.warn("Rejected submission: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(QuotaExceededException.class, e -> {
                log.error("Quota exceeded: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobSubmitResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "Newest first, optionally filtered by state and engine")
    public Mono<ResponseEntity<List<JobStatusResponse>>> listJobs(
            @RequestParam(required = false) JobState state,
            @RequestParam(required = false) String engineId,
            @RequestParam(defaultValue = "50") int limit) {

        return jobManager.listJobs(state, engineId, Math.max(1, limit))
            .map(JobStatusResponse::from)
            .collectList()
            .map(ResponseEntity::ok)
            .onErrorResume(UnknownEngineException.class, e -> Mono.just(ResponseEntity.badRequest().build()));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Job status")
    public Mono<ResponseEntity<JobStatusResponse>> getJobStatus(@PathVariable String jobId) {
        return jobManager.getStatus(jobId)
            .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(JobStatusResponse.error(jobId, e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Error reading status of job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobStatusResponse.error(jobId, e.getMessage())));
            });
    }

    @GetMapping("/{jobId}/result")
    @Operation(summary = "Job result", description = "Rows and stats once SUCCEEDED, error once FAILED; 409 while unfinished")
    public Mono<ResponseEntity<JobResultResponse>> getJobResult(@PathVariable String jobId) {
        return jobManager.getResult(jobId)
            .map(job -> ResponseEntity.ok(JobResultResponse.from(job)))
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(JobResultResponse.error(jobId, ErrorKind.NOT_FOUND, e.getMessage()))))
            .onErrorResume(NotReadyException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(JobResultResponse.builder()
                    .jobId(jobId)
                    .status(e.getState())
                    .errorKind(ErrorKind.NOT_READY)
                    .errorMessage(e.getMessage())
                    .build())))
            .onErrorResume(Exception.class, e -> {
                log.error("Error reading result of job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobResultResponse.error(jobId, null, e.getMessage())));
            });
    }

    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "Cancel a job", description = "Idempotent; a finished job is returned unchanged")
    public Mono<ResponseEntity<JobCancellationResponse>> cancelJob(@PathVariable String jobId) {
        log.info("Job cancellation request for {}", jobId);

        return jobManager.cancel(jobId)
            .map(job -> ResponseEntity.ok(JobCancellationResponse.from(job)))
            .onErrorResume(NotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(JobCancellationResponse.error(jobId, e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Error cancelling job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobCancellationResponse.error(jobId, e.getMessage())));
            });
    }
}
