package com.whereq.vigil.job;

import com.whereq.vigil.logging.LogSession;
import lombok.Builder;
import lombok.Value;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Explicit state of one invocation, threaded through every call that works for a job:
 * which job, its log session, its remaining deadline and the snapshot the fetch phase committed.
 */
@Value
@Builder(toBuilder = true)
public class RunContext {

    public static final String MDC_JOB = "job";
    public static final String MDC_RUN = "run";

    String runId;

    /**
     * Job this context works for, null at the top level
     */
    String jobName;

    Instant startedAt;

    /**
     * Absolute deadline of the current phase, null when unbounded
     */
    Instant deadline;

    LogSession logSession;

    /**
     * Snapshot committed by the fetch phase
     */
    Path snapshot;

    /**
     * Scan concurrency requested on the command line, null for the configured default
     */
    Integer threads;

    public static RunContext root(Integer threads) {
        return RunContext.builder()
            .runId(UUID.randomUUID().toString().substring(0, 8))
            .startedAt(Instant.now())
            .threads(threads)
            .build();
    }

    /**
     * Context of one job inside this invocation. A log session is inherited only by the same job.
     */
    public RunContext forJob(String name) {
        boolean sameJob = name.equals(jobName);
        return toBuilder()
            .jobName(name)
            .startedAt(Instant.now())
            .deadline(sameJob ? deadline : null)
            .logSession(sameJob ? logSession : null)
            .snapshot(sameJob ? snapshot : null)
            .build();
    }

    /**
     * Narrow the deadline to at most {@code timeout} from now.
     */
    public RunContext withTimeout(Duration timeout) {
        Instant candidate = Instant.now().plus(timeout);
        Instant effective = deadline == null || candidate.isBefore(deadline) ? candidate : deadline;
        return toBuilder().deadline(effective).build();
    }

    public RunContext withLogSession(LogSession session) {
        return toBuilder().logSession(session).build();
    }

    public RunContext withSnapshot(Path path) {
        return toBuilder().snapshot(path).build();
    }

    /**
     * Time left before the deadline, capped at {@code limit}.
     */
    public Duration remaining(Duration limit) {
        if (deadline == null) {
            return limit;
        }
        Duration left = Duration.between(Instant.now(), deadline);
        if (left.isNegative()) {
            return Duration.ZERO;
        }
        return left.compareTo(limit) < 0 ? left : limit;
    }

    /**
     * Run the task with this context's job and run ids in the MDC of whatever thread executes it.
     */
    public <T> Callable<T> wrap(Callable<T> task) {
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            installMdc();
            try {
                return task.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    public void installMdc() {
        if (jobName != null) {
            MDC.put(MDC_JOB, jobName);
        }
        if (runId != null) {
            MDC.put(MDC_RUN, runId);
        }
    }
}
