package com.whereq.vigil.lock;

import lombok.AccessLevel;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped ownership of one job's lock. Releasing is idempotent and safe from any thread,
 * so normal completion, error paths and shutdown can all call it.
 */
@Getter
public final class LockHandle implements AutoCloseable {

    @Getter(AccessLevel.NONE)
    private final JobLockManager manager;
    private final String jobName;
    private final String holderId;
    private final Path marker;
    private final Instant acquiredAt;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean released = new AtomicBoolean(false);

    @Getter(AccessLevel.NONE)
    private volatile ScheduledFuture<?> heartbeat;

    LockHandle(JobLockManager manager, String jobName, String holderId, Path marker, Instant acquiredAt) {
        this.manager = manager;
        this.jobName = jobName;
        this.holderId = holderId;
        this.marker = marker;
        this.acquiredAt = acquiredAt;
    }

    void attachHeartbeat(ScheduledFuture<?> heartbeat) {
        this.heartbeat = heartbeat;
    }

    void cancelHeartbeat() {
        ScheduledFuture<?> future = heartbeat;
        if (future != null) {
            future.cancel(false);
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            manager.release(this);
        }
    }

    @Override
    public void close() {
        release();
    }
}
