package com.coursegen.core.model;

/**
 * Classification of a stage failure, used to decide whether it is retried.
 */
public enum ErrorClass {
    TIMEOUT,
    TRANSIENT_REJECTION,
    MALFORMED_INPUT,
    POLICY_REJECTION,
    MERGE_CONFLICT,
    UNKNOWN
}
