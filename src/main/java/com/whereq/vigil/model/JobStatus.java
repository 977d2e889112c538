package com.whereq.vigil.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * PENDING → RUNNING → {SUCCEEDED, FAILED, TIMED_OUT}
 * PENDING → SKIPPED (another live instance holds the job lock)
 */
public enum JobStatus {
    /**
     * Registered for this invocation, not started yet
     */
    PENDING,

    /**
     * Lock held, fetch or process phase executing
     */
    RUNNING,

    /**
     * Both phases completed successfully
     */
    SUCCEEDED,

    /**
     * Terminated with error in the fetch or process phase
     */
    FAILED,

    /**
     * A phase exceeded its deadline
     */
    TIMED_OUT,

    /**
     * Another live instance already runs this job
     */
    SKIPPED;

    /**
     * Check if this state counts against the aggregate exit status
     */
    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT;
    }
}
