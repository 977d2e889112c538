package com.whereq.vigil.exception;

import java.time.Duration;

/**
 * Exception thrown when an external operation exceeded its deadline
 */
public class OperationTimeoutException extends RuntimeException {
    public OperationTimeoutException(String operation, Duration deadline) {
        super(operation + " timed out after " + deadline.toSeconds() + "s");
    }
}
