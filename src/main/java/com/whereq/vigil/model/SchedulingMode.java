package com.whereq.vigil.model;

/**
 * How a multi-job invocation runs its jobs
 */
public enum SchedulingMode {
    /**
     * One job at a time, in registry order
     */
    SEQUENTIAL,

    /**
     * Every job as an independent unit of concurrency
     */
    PARALLEL
}
