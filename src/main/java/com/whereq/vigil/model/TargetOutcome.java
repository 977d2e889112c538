package com.whereq.vigil.model;

/**
 * Probe outcome of a single scan target
 */
public enum TargetOutcome {
    PENDING,
    SUCCESS,
    FAILED
}
