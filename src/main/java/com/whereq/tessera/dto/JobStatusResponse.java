package com.whereq.tessera.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.tessera.model.ErrorKind;
import com.whereq.tessera.model.Job;
import com.whereq.tessera.model.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Status snapshot of a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {
    private String jobId;
    private String engineId;
    private JobState status;
    private String queryText;
    private Instant submittedAt;
    private Instant startedAt;
    private Instant finishedAt;

    /** Set when FAILED */
    private ErrorKind errorKind;
    private String errorMessage;

    public static JobStatusResponse from(Job job) {
        JobStatusResponseBuilder builder = JobStatusResponse.builder()
            .jobId(job.getId())
            .engineId(job.getEngineId())
            .status(job.getState())
            .queryText(job.getQueryText())
            .submittedAt(job.getSubmittedAt())
            .startedAt(job.getStartedAt())
            .finishedAt(job.getFinishedAt());
        if (job.getError() != null) {
            builder.errorKind(job.getError().getKind()).errorMessage(job.getError().getMessage());
        }
        return builder.build();
    }

    public static JobStatusResponse error(String jobId, String message) {
        return JobStatusResponse.builder().jobId(jobId).errorMessage(message).build();
    }
}
