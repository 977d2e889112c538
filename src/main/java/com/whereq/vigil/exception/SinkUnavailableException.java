package com.whereq.vigil.exception;

/**
 * Exception thrown when the record sink cannot accept a batch
 */
public class SinkUnavailableException extends RuntimeException {
    public SinkUnavailableException(String message) {
        super(message);
    }

    public SinkUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
