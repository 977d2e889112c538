package com.whereq.vigil.exception;

import lombok.Getter;

/**
 * Exception thrown when an external program exits non-zero for a reason other than a timeout
 */
@Getter
public class OperationFailedException extends RuntimeException {

    private final int exitCode;

    public OperationFailedException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }
}
