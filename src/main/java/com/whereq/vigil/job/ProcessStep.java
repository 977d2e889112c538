package com.whereq.vigil.job;

/**
 * Process phase of a job: consume the snapshot and update durable storage.
 */
@FunctionalInterface
public interface ProcessStep {

    /**
     * @param context run context carrying the snapshot committed by the fetch phase
     * @throws Exception when processing fails
     */
    void process(RunContext context) throws Exception;
}
