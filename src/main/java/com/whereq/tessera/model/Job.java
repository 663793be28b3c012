package com.whereq.tessera.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Immutable snapshot of one query execution attempt.
 *
 * Every state change produces a new snapshot, so a reader holding a
 * snapshot always sees state, result and error that belong together.
 *
 * @author WhereQ Inc.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Job {
    /** Job identifier */
    String id;

    /** Canonical engine id */
    String engineId;

    /** SQL text */
    String queryText;

    JobState state;

    Instant submittedAt;
    Instant startedAt;
    Instant finishedAt;

    /** Present only in SUCCEEDED */
    QueryResult result;

    /** Present only in FAILED */
    JobError error;

    public static Job queued(String id, String engineId, String queryText, Instant now) {
        return Job.builder()
            .id(id)
            .engineId(engineId)
            .queryText(queryText)
            .state(JobState.QUEUED)
            .submittedAt(now)
            .build();
    }

    public Job started(Instant now) {
        return transition(JobState.RUNNING).startedAt(now).build();
    }

    public Job succeeded(QueryResult result, Instant now) {
        return transition(JobState.SUCCEEDED).result(result).finishedAt(now).build();
    }

    public Job failed(JobError error, Instant now) {
        return transition(JobState.FAILED).error(error).finishedAt(now).build();
    }

    public Job cancelled(Instant now) {
        return transition(JobState.CANCELLED).finishedAt(now).build();
    }

    private JobBuilder transition(JobState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + state + " to " + next);
        }
        return toBuilder().state(next);
    }
}
