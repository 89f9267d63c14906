package com.coursegen.core.model;

/**
 * Whether a pass generates the whole outline or replaces targeted entries of a prior run.
 */
public enum RunScope {
    FULL,
    NARROW
}
