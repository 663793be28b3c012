package com.whereq.tessera.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.tessera.model.Column;
import com.whereq.tessera.model.ErrorKind;
import com.whereq.tessera.model.ExecutionStats;
import com.whereq.tessera.model.Job;
import com.whereq.tessera.model.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of a finished job: rows for SUCCEEDED, error for FAILED,
 * neither for CANCELLED
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobResultResponse {
    private String jobId;
    private JobState status;
    private List<Column> columns;
    private List<List<Object>> rows;
    private ExecutionStats stats;
    private ErrorKind errorKind;
    private String errorMessage;

    public static JobResultResponse from(Job job) {
        JobResultResponseBuilder builder = JobResultResponse.builder()
            .jobId(job.getId())
            .status(job.getState());
        if (job.getResult() != null) {
            builder.columns(job.getResult().getColumns())
                .rows(job.getResult().getRows())
                .stats(job.getResult().getStats());
        }
        if (job.getError() != null) {
            builder.errorKind(job.getError().getKind()).errorMessage(job.getError().getMessage());
        }
        return builder.build();
    }

    public static JobResultResponse error(String jobId, ErrorKind kind, String message) {
        return JobResultResponse.builder().jobId(jobId).errorKind(kind).errorMessage(message).build();
    }
}
