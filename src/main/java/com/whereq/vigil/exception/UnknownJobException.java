package com.whereq.vigil.exception;

/**
 * Exception thrown when a job name is not in the registry
 */
public class UnknownJobException extends RuntimeException {
    public UnknownJobException(String jobName) {
        super("Unknown job: " + jobName);
    }
}
