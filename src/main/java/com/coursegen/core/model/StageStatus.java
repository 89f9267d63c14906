package com.coursegen.core.model;

public enum StageStatus {
    OK,
    PARTIAL,
    FAILED
}
