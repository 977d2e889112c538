package com.whereq.vigil.model;

import lombok.Value;

import java.time.Duration;

/**
 * Observed state of one job's lock marker
 */
@Value
public class LockState {

    public enum Kind {
        /**
         * No marker present
         */
        FREE,

        /**
         * Marker held by a live holder
         */
        HELD,

        /**
         * Marker left behind by a dead holder
         */
        STALE
    }

    String jobName;
    Kind kind;
    LockMarker marker;
    Duration heartbeatAge;

    public static LockState free(String jobName) {
        return new LockState(jobName, Kind.FREE, null, null);
    }
}
