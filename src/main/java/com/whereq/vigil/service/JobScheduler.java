package com.whereq.vigil.service;

import com.whereq.vigil.job.JobDefinition;
import com.whereq.vigil.job.JobRegistry;
import com.whereq.vigil.job.RunContext;
import com.whereq.vigil.model.JobPhase;
import com.whereq.vigil.model.JobResult;
import com.whereq.vigil.model.JobStatus;
import com.whereq.vigil.model.RunSummary;
import com.whereq.vigil.model.SchedulingMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Runs several jobs in one invocation, one at a time or all at once.
 *
 * <p>Jobs share nothing but the filesystem; one job's failure never stops or affects another.
 * Whatever the completion order, the summary lists jobs in the order they were requested.</p>
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class JobScheduler {

    private static final String CANCELLED = "Cancelled by shutdown";

    private final JobRegistry registry;
    private final JobRunner runner;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<CompletableFuture<List<JobResult>>> inFlight = new AtomicReference<>();

    public JobScheduler(JobRegistry registry, JobRunner runner) {
        this.registry = registry;
        this.runner = runner;
    }

    /**
     * Run every registered job.
     */
    public RunSummary runAll(SchedulingMode mode, RunContext context) {
        return run(registry.names(), mode, context, true);
    }

    /**
     * Run one job; the summary's exit code is the job's own.
     */
    public RunSummary runOne(String jobName, RunContext context) {
        return run(List.of(jobName), SchedulingMode.SEQUENTIAL, context, false);
    }

    public RunSummary run(List<String> jobNames, SchedulingMode mode, RunContext context, boolean aggregate) {
        List<JobDefinition> jobs = jobNames.stream().map(registry::get).collect(Collectors.toList());
        log.info("Running {} job(s) {}: {}", jobs.size(), mode.name().toLowerCase(), String.join(", ", jobNames));

        List<JobResult> results = mode == SchedulingMode.PARALLEL && jobs.size() > 1
            ? runParallel(jobs, context)
            : runSequential(jobs, context);

        RunSummary summary = new RunSummary(results, mode, aggregate);
        logSummary(summary);
        return summary;
    }

    /**
     * Stop launching jobs and cancel those in flight. Their locks are released on the way out.
     */
    public void cancelInFlight() {
        cancelled.set(true);
        CompletableFuture<List<JobResult>> future = inFlight.get();
        if (future != null && future.cancel(true)) {
            log.warn("Cancelled in-flight jobs");
        }
    }

    private List<JobResult> runSequential(List<JobDefinition> jobs, RunContext context) {
        List<JobResult> results = new ArrayList<>(jobs.size());
        for (JobDefinition job : jobs) {
            if (cancelled.get()) {
                results.add(cancelledResult(job.getName()));
                continue;
            }
            results.add(runSafely(job, context));
        }
        return results;
    }

    private List<JobResult> runParallel(List<JobDefinition> jobs, RunContext context) {
        Map<String, JobResult> finished = new ConcurrentHashMap<>();
        CompletableFuture<List<JobResult>> future = Flux.fromIterable(jobs)
            .flatMapSequential(job -> Mono.fromCallable(() -> runSafely(job, context))
                    .doOnNext(result -> finished.put(job.getName(), result))
                    .subscribeOn(Schedulers.boundedElastic()),
                jobs.size())
            .collectList()
            .toFuture();

        inFlight.set(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
        try {
            return future.get();
        } catch (CancellationException e) {
            return fillCancelled(jobs, finished);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return fillCancelled(jobs, finished);
        } catch (ExecutionException e) {
            // runSafely never throws, so this is a scheduler fault
            log.error("Parallel run failed", e.getCause());
            return fillCancelled(jobs, finished);
        } finally {
            inFlight.compareAndSet(future, null);
        }
    }

    private JobResult runSafely(JobDefinition job, RunContext context) {
        try {
            return runner.run(job, context);
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly: {}", job.getName(), e.getMessage(), e);
            return JobResult.builder()
                .jobName(job.getName())
                .status(JobStatus.FAILED)
                .failedPhase(JobPhase.PROCESS)
                .exitCode(1)
                .errorMessage(e.getMessage())
                .elapsed(Duration.ZERO)
                .startedAt(Instant.now())
                .build();
        }
    }

    private static List<JobResult> fillCancelled(List<JobDefinition> jobs, Map<String, JobResult> finished) {
        return jobs.stream()
            .map(job -> finished.getOrDefault(job.getName(), cancelledResult(job.getName())))
            .collect(Collectors.toList());
    }

    private static JobResult cancelledResult(String jobName) {
        return JobResult.builder()
            .jobName(jobName)
            .status(JobStatus.FAILED)
            .exitCode(1)
            .errorMessage(CANCELLED)
            .elapsed(Duration.ZERO)
            .startedAt(Instant.now())
            .build();
    }

    private void logSummary(RunSummary summary) {
        log.info("=== RUN SUMMARY ({}) ===", summary.getMode().name().toLowerCase());
        for (JobResult result : summary.getResults()) {
            log.info("  {} {} in {}s{}",
                String.format("%-12s", result.getJobName()),
                String.format("%-10s", result.getStatus()),
                String.format("%.1f", result.getElapsed().toMillis() / 1000.0),
                result.getExitCode() != 0 ? " (exit code " + result.getExitCode() + ")" : "");
        }
        if (!summary.getSucceededJobs().isEmpty()) {
            log.info("Successful jobs: {}", String.join(" ", summary.getSucceededJobs()));
        }
        if (!summary.getSkippedJobs().isEmpty()) {
            log.info("Skipped jobs (already running): {}", String.join(" ", summary.getSkippedJobs()));
        }
        if (!summary.getFailedJobs().isEmpty()) {
            log.error("Failed jobs: {}", String.join(" ", summary.getFailedJobs()));
        }
        log.info("{} of {} job(s) failed", summary.getFailedCount(), summary.getResults().size());
    }
}
