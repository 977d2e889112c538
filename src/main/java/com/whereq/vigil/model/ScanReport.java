package com.whereq.vigil.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Completion summary of one scan batch
 */
@Value
@Builder
public class ScanReport {
    int total;

    /**
     * Targets that finished, successfully or not
     */
    int completed;

    int succeeded;

    int failed;

    /**
     * First failures only, bounded by the configured preview size
     */
    List<ProbeResult> failurePreview;

    int findingsPersisted;

    Instant startedAt;

    Instant finishedAt;

    public Duration getElapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * Average throughput in targets per second
     */
    public double getAverageRate() {
        double seconds = getElapsed().toMillis() / 1000.0;
        return seconds > 0 ? completed / seconds : 0.0;
    }
}
