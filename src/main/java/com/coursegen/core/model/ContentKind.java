package com.coursegen.core.model;

public enum ContentKind {
    LESSON,
    LAB_PLAN,
    LAB
}
