package com.coursegen.core.model;

/**
 * Lifecycle status of a generation run.
 */
public enum RunStatus {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED,
    PARTIALLY_COMPLETED   // Deferred or continuation units remain for a follow-up invocation
}
