package com.whereq.vigil.service;

import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.job.JobRegistry;
import com.whereq.vigil.lock.JobLockManager;
import com.whereq.vigil.model.LockMarker;
import com.whereq.vigil.model.LockState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Operator view of running jobs, read from the lock markers: status listing and stopping.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class JobControlService {

    private final JobRegistry registry;
    private final JobLockManager lockManager;
    private final Duration grace;

    public JobControlService(JobRegistry registry, JobLockManager lockManager, VigilProperties properties) {
        this.registry = registry;
        this.lockManager = lockManager;
        this.grace = properties.getShutdownGrace();
    }

    /**
     * Lock state of every registered job, in registry order.
     */
    public List<LockState> status() {
        List<LockState> states = lockManager.inspectAll(registry.names());
        log.info("=== JOB STATUS ===");
        for (LockState state : states) {
            switch (state.getKind()) {
                case HELD -> log.info("  {} RUNNING (holder {}, heartbeat {}s ago)",
                    pad(state.getJobName()), holder(state.getMarker()), state.getHeartbeatAge().toSeconds());
                case STALE -> log.warn("  {} STALE (holder {} is gone, marker will be reclaimed)",
                    pad(state.getJobName()), holder(state.getMarker()));
                default -> log.info("  {} STOPPED", pad(state.getJobName()));
            }
        }
        return states;
    }

    /**
     * Terminate every job held by another process on this host and remove its marker.
     * Stale markers are removed; holders on other hosts are only reported.
     *
     * @return number of jobs stopped
     */
    public int stop() {
        int stopped = 0;
        long self = ProcessHandle.current().pid();

        for (LockState state : lockManager.inspectAll(registry.names())) {
            String jobName = state.getJobName();
            LockMarker marker = state.getMarker();

            switch (state.getKind()) {
                case FREE -> log.debug("{} is not running", jobName);
                case STALE -> {
                    log.warn("Removing stale lock for {}", jobName);
                    lockManager.forceRemove(jobName);
                }
                case HELD -> {
                    if (marker == null || !lockManager.isLocal(marker)) {
                        log.warn("{} is held by {} on another host, not stopping it", jobName, holder(marker));
                    } else if (marker.getPid() == self) {
                        log.debug("{} is held by this process", jobName);
                    } else {
                        terminate(jobName, marker.getPid());
                        lockManager.forceRemove(jobName);
                        stopped++;
                    }
                }
            }
        }

        log.info("Stopped {} job(s)", stopped);
        return stopped;
    }

    private void terminate(String jobName, long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            log.info("{} (PID {}) already exited", jobName, pid);
            return;
        }

        ProcessHandle process = handle.get();
        log.info("Stopping {} (PID {})", jobName, pid);
        process.destroy();
        try {
            process.onExit().get(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} (PID {}) did not exit within {}s, killing it", jobName, pid, grace.toSeconds());
            process.destroyForcibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        } catch (ExecutionException e) {
            log.warn("Could not wait for {} (PID {}): {}", jobName, pid, e.getMessage());
        }
    }

    private static String holder(LockMarker marker) {
        return marker != null ? marker.getHolderId() : "unknown";
    }

    private static String pad(String jobName) {
        return String.format("%-12s", jobName);
    }
}
