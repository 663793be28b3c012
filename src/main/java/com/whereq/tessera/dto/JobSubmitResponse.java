package com.whereq.tessera.dto;

import com.whereq.tessera.model.Job;
import com.whereq.tessera.model.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitResponse {
    /**
     * Unique job identifier
     */
    private String jobId;

    /**
     * Canonical engine id
     */
    private String engineId;

    /**
     * Current job state
     */
    private JobState status;

    /**
     * When the job was submitted
     */
    private Instant submittedAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    public static JobSubmitResponse from(Job job) {
        return JobSubmitResponse.builder()
            .jobId(job.getId())
            .engineId(job.getEngineId())
            .status(job.getState())
            .submittedAt(job.getSubmittedAt())
            .build();
    }

    /**
     * Create error response
     */
    public static JobSubmitResponse error(String message) {
        return JobSubmitResponse.builder()
            .errorMessage(message)
            .build();
    }
}
