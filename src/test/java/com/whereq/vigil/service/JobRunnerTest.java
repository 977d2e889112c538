package com.whereq.vigil.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.vigil.config.VigilProperties.JobKind;
import com.whereq.vigil.exception.FetchInvalidException;
import com.whereq.vigil.exception.OperationFailedException;
import com.whereq.vigil.executor.ManagedProcessRegistry;
import com.whereq.vigil.executor.TimeoutGuardedExecutor;
import com.whereq.vigil.job.CommandProcessStep;
import com.whereq.vigil.job.FetchStep;
import com.whereq.vigil.job.JobDefinition;
import com.whereq.vigil.job.ProcessStep;
import com.whereq.vigil.job.RunContext;
import com.whereq.vigil.lock.JobLockManager;
import com.whereq.vigil.lock.LockHandle;
import com.whereq.vigil.logging.LogSessionManager;
import com.whereq.vigil.model.JobPhase;
import com.whereq.vigil.model.JobResult;
import com.whereq.vigil.model.JobStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class JobRunnerTest {

    @TempDir
    Path dir;

    private JobLockManager lockManager;
    private ManagedProcessRegistry processes;
    private SimpleMeterRegistry meterRegistry;
    private JobRunner runner;

    @BeforeEach
    void setUp() {
        lockManager = new JobLockManager(dir.resolve("locks"), Duration.ofHours(1), Duration.ofSeconds(90),
            new ObjectMapper().findAndRegisterModules());
        meterRegistry = new SimpleMeterRegistry();
        processes = new ManagedProcessRegistry(Duration.ofSeconds(1));
        runner = new JobRunner(lockManager,
            new TimeoutGuardedExecutor(processes),
            new LogSessionManager(dir.resolve("logs"), 10),
            meterRegistry);
    }

    @AfterEach
    void tearDown() {
        lockManager.shutdown();
    }

    @Test
    void successfulRunPassesSnapshotToProcessPhase() {
        Path fetched = dir.resolve("gossip_data.json");
        AtomicReference<Path> seen = new AtomicReference<>();

        JobResult result = runner.run(job("gossip", context -> fetched, context -> seen.set(context.getSnapshot())),
            RunContext.root(null));

        assertThat(result.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(result.getExitCode()).isZero();
        assertThat(seen.get()).isEqualTo(fetched);
        assertThat(lockManager.markerPath("gossip")).doesNotExist();
        assertThat(meterRegistry.counter("vigil.jobs.completed", "job", "gossip", "status", "succeeded").count())
            .isEqualTo(1.0);
    }

    @Test
    void processFailureStillReleasesLock() {
        JobResult result = runner.run(job("validators", null, context -> {
            throw new OperationFailedException("parser exited with 2", 2);
        }), RunContext.root(null));

        assertThat(result.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(result.getFailedPhase()).isEqualTo(JobPhase.PROCESS);
        assertThat(result.getExitCode()).isEqualTo(2);
        assertThat(result.getErrorMessage()).contains("parser exited");
        assertThat(lockManager.markerPath("validators")).doesNotExist();
    }

    @Test
    void fetchFailureSkipsProcessPhase() {
        AtomicBoolean processed = new AtomicBoolean(false);

        JobResult result = runner.run(job("metadata",
            context -> {
                throw new FetchInvalidException("Fetched data too small: 2 bytes (minimum 11)");
            },
            context -> processed.set(true)), RunContext.root(null));

        assertThat(result.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(result.getFailedPhase()).isEqualTo(JobPhase.FETCH);
        assertThat(processed).isFalse();
        assertThat(lockManager.markerPath("metadata")).doesNotExist();
    }

    @Test
    void runningJobIsSkippedWithoutSideEffects() {
        AtomicBoolean processed = new AtomicBoolean(false);

        try (LockHandle held = lockManager.acquire("ports")) {
            JobResult result = runner.run(job("ports", null, context -> processed.set(true)), RunContext.root(null));

            assertThat(result.getStatus()).isEqualTo(JobStatus.SKIPPED);
            assertThat(result.getExitCode()).isZero();
            assertThat(result.isFailure()).isFalse();
            assertThat(processed).isFalse();
            assertThat(lockManager.markerPath("ports")).exists();
            assertThat(held.isReleased()).isFalse();
        }
    }

    @Test
    void slowProcessTimesOutWithCode124() {
        JobDefinition slow = JobDefinition.builder()
            .name("ports")
            .kind(JobKind.SCAN)
            .processStep(context -> Thread.sleep(10_000))
            .processTimeout(Duration.ofMillis(200))
            .build();

        JobResult result = runner.run(slow, RunContext.root(null));

        assertThat(result.getStatus()).isEqualTo(JobStatus.TIMED_OUT);
        assertThat(result.getExitCode()).isEqualTo(124);
        assertThat(result.getFailedPhase()).isEqualTo(JobPhase.PROCESS);
        assertThat(result.getElapsed()).isLessThan(Duration.ofSeconds(5));
        assertThat(lockManager.markerPath("ports")).doesNotExist();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void timedOutCommandTreeIsKilledBeforeLockRelease() throws Exception {
        Path late = dir.resolve("late.txt");
        String script = "trap '' TERM; (sleep 2; echo late > " + late + ") & wait";
        JobDefinition stubborn = JobDefinition.builder()
            .name("validators")
            .kind(JobKind.COMMAND)
            .processStep(new CommandProcessStep(List.of("sh", "-c", script), null, Duration.ofSeconds(30),
                new TimeoutGuardedExecutor(processes)))
            .processTimeout(Duration.ofMillis(500))
            .build();

        JobResult result = runner.run(stubborn, RunContext.root(null));

        assertThat(result.getStatus()).isEqualTo(JobStatus.TIMED_OUT);
        assertThat(result.getExitCode()).isEqualTo(124);
        assertThat(lockManager.markerPath("validators")).doesNotExist();
        assertThat(processes.size()).isZero();

        Thread.sleep(3000);
        assertThat(late).doesNotExist();
    }

    @Test
    void jobContextCarriesDeadlineAndMdc() {
        AtomicReference<Duration> remaining = new AtomicReference<>();
        AtomicReference<String> mdcJob = new AtomicReference<>();

        runner.run(job("gossip", null, context -> {
            remaining.set(context.remaining(Duration.ofHours(1)));
            mdcJob.set(org.slf4j.MDC.get(RunContext.MDC_JOB));
        }), RunContext.root(null));

        assertThat(remaining.get()).isLessThanOrEqualTo(Duration.ofSeconds(5));
        assertThat(mdcJob.get()).isEqualTo("gossip");
    }

    private static JobDefinition job(String name, FetchStep fetch, ProcessStep process) {
        return JobDefinition.builder()
            .name(name)
            .kind(JobKind.SNAPSHOT)
            .fetchStep(fetch)
            .processStep(process)
            .fetchTimeout(Duration.ofSeconds(5))
            .processTimeout(Duration.ofSeconds(5))
            .build();
    }
}
