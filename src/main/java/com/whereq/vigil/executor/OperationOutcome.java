package com.whereq.vigil.executor;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * Result of one guarded external operation: success, failure with a code, or timeout.
 *
 * @param <T> value produced by a successful operation
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationOutcome<T> {

    public static final int SUCCESS_EXIT_CODE = 0;
    public static final int FAILURE_EXIT_CODE = 1;
    public static final int TIMEOUT_EXIT_CODE = 124;

    public enum Status {
        SUCCESS,
        FAILURE,
        TIMED_OUT
    }

    Status status;
    T value;
    int exitCode;
    String message;
    Duration elapsed;

    public static <T> OperationOutcome<T> success(T value, Duration elapsed) {
        return new OperationOutcome<>(Status.SUCCESS, value, SUCCESS_EXIT_CODE, null, elapsed);
    }

    public static <T> OperationOutcome<T> failure(int exitCode, String message, Duration elapsed) {
        int code = exitCode == SUCCESS_EXIT_CODE ? FAILURE_EXIT_CODE : exitCode;
        return new OperationOutcome<>(Status.FAILURE, null, code, message, elapsed);
    }

    public static <T> OperationOutcome<T> timedOut(String message, Duration elapsed) {
        return new OperationOutcome<>(Status.TIMED_OUT, null, TIMEOUT_EXIT_CODE, message, elapsed);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isTimedOut() {
        return status == Status.TIMED_OUT;
    }
}
