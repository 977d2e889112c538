package com.whereq.vigil.model;

/**
 * Phase of a job a failure is attributed to
 */
public enum JobPhase {
    LOCK,
    FETCH,
    PROCESS
}
