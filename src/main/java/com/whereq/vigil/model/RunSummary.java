package com.whereq.vigil.model;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregate outcome of one invocation, in the order the jobs were requested
 */
@Getter
public class RunSummary {

    private static final int MAX_EXIT_CODE = 255;

    private final List<JobResult> results;
    private final SchedulingMode mode;
    private final boolean aggregate;

    /**
     * @param results   per-job results in canonical (input) order
     * @param mode      scheduling mode used
     * @param aggregate true for an "all" style invocation whose exit code is the failure count
     */
    public RunSummary(List<JobResult> results, SchedulingMode mode, boolean aggregate) {
        this.results = List.copyOf(results);
        this.mode = mode;
        this.aggregate = aggregate;
    }

    public int getFailedCount() {
        return (int) results.stream().filter(JobResult::isFailure).count();
    }

    public List<String> getSucceededJobs() {
        return results.stream()
            .filter(r -> r.getStatus() == JobStatus.SUCCEEDED)
            .map(JobResult::getJobName)
            .collect(Collectors.toList());
    }

    public List<String> getFailedJobs() {
        return results.stream()
            .filter(JobResult::isFailure)
            .map(JobResult::getJobName)
            .collect(Collectors.toList());
    }

    public List<String> getSkippedJobs() {
        return results.stream()
            .filter(r -> r.getStatus() == JobStatus.SKIPPED)
            .map(JobResult::getJobName)
            .collect(Collectors.toList());
    }

    /**
     * Process exit code: the failed-job count for aggregate runs, the job's own code otherwise.
     */
    public int exitCode() {
        if (aggregate || results.size() != 1) {
            return Math.min(getFailedCount(), MAX_EXIT_CODE);
        }
        return results.get(0).getExitCode();
    }
}
