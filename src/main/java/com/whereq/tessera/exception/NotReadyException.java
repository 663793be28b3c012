package com.whereq.tessera.exception;

import com.whereq.tessera.model.JobState;
import lombok.Getter;

/**
 * Exception thrown when a result is requested before the job is terminal
 */
@Getter
public class NotReadyException extends RuntimeException {
    private final JobState state;

    public NotReadyException(String jobId, JobState state) {
        super("Job " + jobId + " is not finished (state: " + state + ")");
        this.state = state;
    }
}
