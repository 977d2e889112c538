package com.whereq.vigil.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one job run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResult {
    /**
     * Job name
     */
    private String jobName;

    /**
     * Final status
     */
    private JobStatus status;

    /**
     * Phase the failure happened in, null on success
     */
    private JobPhase failedPhase;

    /**
     * Exit code of the run: 0, the failing operation's code, or 124 on timeout
     */
    private int exitCode;

    /**
     * Error message if failed or skipped
     */
    private String errorMessage;

    /**
     * Wall-clock time of the run
     */
    private Duration elapsed;

    /**
     * When the run started
     */
    private Instant startedAt;

    public boolean isFailure() {
        return status != null && status.isFailure();
    }

    public static JobResult skipped(String jobName, String reason, Instant startedAt) {
        return JobResult.builder()
            .jobName(jobName)
            .status(JobStatus.SKIPPED)
            .failedPhase(JobPhase.LOCK)
            .exitCode(0)
            .errorMessage(reason)
            .elapsed(Duration.ZERO)
            .startedAt(startedAt)
            .build();
    }
}
