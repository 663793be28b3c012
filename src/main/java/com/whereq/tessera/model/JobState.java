package com.whereq.tessera.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * QUEUED → RUNNING → {SUCCEEDED, FAILED, CANCELLED}
 * QUEUED → CANCELLED (cancelled before a worker picked it up)
 */
public enum JobState {
    /**
     * Waiting in the engine queue
     */
    QUEUED,

    /**
     * Owned by a worker, executing on the engine
     */
    RUNNING,

    /**
     * Completed with a result
     */
    SUCCEEDED,

    /**
     * Terminated with an error
     */
    FAILED,

    /**
     * User-initiated cancellation
     */
    CANCELLED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if a transition from this state to {@code next} is allowed
     */
    public boolean canTransitionTo(JobState next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == CANCELLED || next == FAILED;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }
}
