package com.whereq.tessera.dto;

import com.whereq.tessera.model.Job;
import com.whereq.tessera.model.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCancellationResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * State after cancellation; a job that had already finished keeps its state
     */
    private JobState status;

    /**
     * When the job reached its terminal state
     */
    private Instant finishedAt;

    /**
     * Cancellation message
     */
    private String message;

    public static JobCancellationResponse from(Job job) {
        String message = job.getState() == JobState.CANCELLED
            ? "Job cancelled"
            : "Job already finished as " + job.getState();
        return JobCancellationResponse.builder()
            .jobId(job.getId())
            .status(job.getState())
            .finishedAt(job.getFinishedAt())
            .message(message)
            .build();
    }

    public static JobCancellationResponse error(String jobId, String message) {
        return JobCancellationResponse.builder().jobId(jobId).message(message).build();
    }
}
