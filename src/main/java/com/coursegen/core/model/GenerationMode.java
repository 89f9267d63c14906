package com.coursegen.core.model;

public enum GenerationMode {
    NEW,
    REGENERATE
}
