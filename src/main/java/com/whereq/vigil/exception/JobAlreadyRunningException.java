package com.whereq.vigil.exception;

import lombok.Getter;

/**
 * Thrown when a live instance already holds the job's lock
 */
@Getter
public class JobAlreadyRunningException extends RuntimeException {

    private final String jobName;
    private final String holderId;

    public JobAlreadyRunningException(String jobName, String holderId) {
        super("Job " + jobName + " is already running (holder: " + holderId + ")");
        this.jobName = jobName;
        this.holderId = holderId;
    }
}
