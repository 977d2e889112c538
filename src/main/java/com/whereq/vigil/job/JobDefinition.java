package com.whereq.vigil.job;

import com.whereq.vigil.config.VigilProperties.JobKind;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * A named two-phase job as registered at startup
 */
@Value
@Builder
public class JobDefinition {

    String name;

    JobKind kind;

    /**
     * Fetch phase, null for jobs that work on existing data only
     */
    FetchStep fetchStep;

    ProcessStep processStep;

    Duration fetchTimeout;

    Duration processTimeout;

    public boolean hasFetchPhase() {
        return fetchStep != null;
    }
}
