package com.whereq.vigil.service;

import com.whereq.vigil.exception.JobAlreadyRunningException;
import com.whereq.vigil.executor.OperationOutcome;
import com.whereq.vigil.executor.TimeoutGuardedExecutor;
import com.whereq.vigil.job.JobDefinition;
import com.whereq.vigil.job.RunContext;
import com.whereq.vigil.lock.JobLockManager;
import com.whereq.vigil.lock.LockHandle;
import com.whereq.vigil.logging.LogSession;
import com.whereq.vigil.logging.LogSessionManager;
import com.whereq.vigil.model.JobPhase;
import com.whereq.vigil.model.JobResult;
import com.whereq.vigil.model.JobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Runs one job: lock, fetch, process, release.
 *
 * <p>A job whose lock is held by a live instance is skipped without side effects. A failed or
 * timed out fetch aborts the job before the process phase. The lock is released on every exit
 * path. Errors never escape; they are reported in the returned {@link JobResult}.</p>
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class JobRunner {

    private final JobLockManager lockManager;
    private final TimeoutGuardedExecutor executor;
    private final LogSessionManager logSessions;
    private final MeterRegistry meterRegistry;

    public JobRunner(JobLockManager lockManager, TimeoutGuardedExecutor executor,
                     LogSessionManager logSessions, MeterRegistry meterRegistry) {
        this.lockManager = lockManager;
        this.executor = executor;
        this.logSessions = logSessions;
        this.meterRegistry = meterRegistry;
    }

    public JobResult run(JobDefinition job, RunContext parent) {
        RunContext jobContext = parent.forJob(job.getName());
        Map<String, String> previousMdc = MDC.getCopyOfContextMap();
        jobContext.installMdc();
        long start = System.nanoTime();

        JobResult result;
        try (LogSession session = logSessions.open(jobContext)) {
            RunContext context = jobContext.withLogSession(session);
            log.info("Starting job {} (run {})", job.getName(), context.getRunId());
            result = runLocked(job, context, start);
            report(result);
        } catch (RuntimeException e) {
            log.error("Job {} aborted: {}", job.getName(), e.getMessage(), e);
            result = failed(job.getName(), JobPhase.PROCESS, OperationOutcome.FAILURE_EXIT_CODE,
                e.getMessage(), jobContext.getStartedAt(), start);
        } finally {
            if (previousMdc != null) {
                MDC.setContextMap(previousMdc);
            } else {
                MDC.clear();
            }
        }

        record(result);
        return result;
    }

    private JobResult runLocked(JobDefinition job, RunContext context, long start) {
        LockHandle lock;
        try {
            lock = lockManager.acquire(job.getName());
        } catch (JobAlreadyRunningException e) {
            log.warn("Job {} is already running (holder {}), skipping", job.getName(), e.getHolderId());
            return JobResult.skipped(job.getName(), e.getMessage(), context.getStartedAt());
        }

        try (LockHandle held = lock) {
            RunContext current = context;

            if (job.hasFetchPhase()) {
                RunContext fetchContext = context.withTimeout(job.getFetchTimeout());
                OperationOutcome<Path> fetched = executor.call(job.getName() + " fetch",
                    fetchContext.wrap(() -> job.getFetchStep().fetch(fetchContext)),
                    job.getFetchTimeout());
                if (!fetched.isSuccess()) {
                    return failed(job.getName(), JobPhase.FETCH, fetched, context.getStartedAt(), start);
                }
                current = context.withSnapshot(fetched.getValue());
            }

            RunContext processContext = current.withTimeout(job.getProcessTimeout());
            OperationOutcome<Object> processed = executor.call(job.getName() + " process",
                processContext.wrap(() -> {
                    job.getProcessStep().process(processContext);
                    return null;
                }),
                job.getProcessTimeout());
            if (!processed.isSuccess()) {
                return failed(job.getName(), JobPhase.PROCESS, processed, context.getStartedAt(), start);
            }

            return JobResult.builder()
                .jobName(job.getName())
                .status(JobStatus.SUCCEEDED)
                .exitCode(OperationOutcome.SUCCESS_EXIT_CODE)
                .startedAt(context.getStartedAt())
                .elapsed(since(start))
                .build();
        }
    }

    private JobResult failed(String jobName, JobPhase phase, OperationOutcome<?> outcome, Instant startedAt, long start) {
        JobResult result = failed(jobName, phase, outcome.getExitCode(), outcome.getMessage(), startedAt, start);
        if (outcome.isTimedOut()) {
            result.setStatus(JobStatus.TIMED_OUT);
        }
        return result;
    }

    private JobResult failed(String jobName, JobPhase phase, int exitCode, String message, Instant startedAt, long start) {
        return JobResult.builder()
            .jobName(jobName)
            .status(JobStatus.FAILED)
            .failedPhase(phase)
            .exitCode(exitCode)
            .errorMessage(message)
            .startedAt(startedAt)
            .elapsed(since(start))
            .build();
    }

    private void report(JobResult result) {
        String elapsed = String.format("%.1fs", result.getElapsed().toMillis() / 1000.0);
        switch (result.getStatus()) {
            case SUCCEEDED -> log.info("Job {} completed successfully in {}", result.getJobName(), elapsed);
            case TIMED_OUT -> log.error("Job {} TIMED OUT in {} phase after {} (exit code {}): {}",
                result.getJobName(), result.getFailedPhase(), elapsed, result.getExitCode(), result.getErrorMessage());
            case FAILED -> log.error("Job {} failed in {} phase after {} (exit code {}): {}",
                result.getJobName(), result.getFailedPhase(), elapsed, result.getExitCode(), result.getErrorMessage());
            default -> log.info("Job {} {}", result.getJobName(), result.getStatus());
        }
    }

    private void record(JobResult result) {
        Counter.builder("vigil.jobs.completed")
            .description("Job runs by final status")
            .tag("job", result.getJobName())
            .tag("status", result.getStatus().name().toLowerCase())
            .register(meterRegistry)
            .increment();
        if (result.getStatus() != JobStatus.SKIPPED) {
            Timer.builder("vigil.jobs.duration")
                .description("Job run time")
                .tag("job", result.getJobName())
                .register(meterRegistry)
                .record(result.getElapsed());
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
