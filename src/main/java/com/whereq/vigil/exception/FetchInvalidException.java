package com.whereq.vigil.exception;

/**
 * Exception thrown when fetched external output is malformed, truncated or too small
 */
public class FetchInvalidException extends RuntimeException {
    public FetchInvalidException(String message) {
        super(message);
    }

    public FetchInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
