package com.coursegen.core.generation;

public enum GenerationKind {
    TEXT,
    IMAGE
}
