package com.coursegen.core.model;

public enum CompletionStatus {
    PARTIAL,
    COMPLETE
}
