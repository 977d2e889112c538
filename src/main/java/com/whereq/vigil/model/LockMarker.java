package com.whereq.vigil.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Content of a job lock marker file
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LockMarker {
    /**
     * Job the marker guards
     */
    private String jobName;

    /**
     * Unique id of the holding invocation
     */
    private String holderId;

    /**
     * Host the holder runs on
     */
    private String host;

    /**
     * Process id of the holder
     */
    private long pid;

    /**
     * When the lock was taken
     */
    private Instant acquiredAt;

    /**
     * Last liveness refresh
     */
    private Instant heartbeatAt;
}
