package com.coursegen.core.model;

/**
 * Final status of one work unit within an invocation.
 */
public enum UnitStatus {
    COMPLETED,
    PARTIAL,
    FAILED,
    DEFERRED
}
