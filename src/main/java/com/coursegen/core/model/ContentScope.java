package com.coursegen.core.model;

/**
 * Which parts of the outline a full generation covers.
 */
public enum ContentScope {
    ALL,
    LESSONS,
    LABS
}
