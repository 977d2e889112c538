package com.whereq.vigil.job;

import java.nio.file.Path;

/**
 * Fetch phase of a job: retrieve fresh external data into the job's snapshot.
 */
@FunctionalInterface
public interface FetchStep {

    /**
     * @param context run context, its deadline bounds the fetch
     * @return the committed snapshot
     * @throws Exception when the data could not be fetched or failed validation;
     *                   the previous snapshot is then left untouched
     */
    Path fetch(RunContext context) throws Exception;
}
