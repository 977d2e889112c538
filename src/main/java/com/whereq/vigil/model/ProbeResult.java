package com.whereq.vigil.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * What one worker reports for the target it owned
 */
@Value
@Builder
public class ProbeResult {
    ScanTarget target;
    TargetOutcome outcome;

    /**
     * Findings of a successful probe, empty when nothing was found
     */
    @Builder.Default
    List<OpenPort> findings = List.of();

    /**
     * Error detail of a failed probe
     */
    String error;

    boolean timedOut;

    Duration elapsed;

    public boolean isSuccess() {
        return outcome == TargetOutcome.SUCCESS;
    }
}
