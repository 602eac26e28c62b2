package com.umitunal.qrunner.core;

/**
 * Lifecycle states of a persisted job record.
 */
public enum JobStatus {
    QUEUED,               // Waiting for its queue date
    STARTED,              // Dequeued and running
    CANCELING,            // Cancel requested, runner has not reacted yet
    CANCELED,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    INTERRUPTED,          // Process went away while the job was running
    FAILED_TO_LOAD_TYPE;  // Job type or payload could not be rebuilt

    /**
     * Checks whether a record in this state will never change again.
     */
    public boolean isTerminal() {
        return switch (this) {
            case QUEUED, STARTED, CANCELING -> false;
            default -> true;
        };
    }

    /**
     * Checks whether a record in this state belongs to a job the runner is executing.
     */
    public boolean isInFlight() {
        return this == STARTED || this == CANCELING;
    }
}
