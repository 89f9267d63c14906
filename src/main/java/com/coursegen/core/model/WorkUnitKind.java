package com.coursegen.core.model;

/**
 * Kind of work unit scheduled by the orchestrator.
 */
public enum WorkUnitKind {
    LESSON_BATCH,
    LAB_BATCH,
    LESSON_REGEN,
    LAB_REGEN;

    public boolean isLab() {
        return this == LAB_BATCH || this == LAB_REGEN;
    }

    public boolean isRegeneration() {
        return this == LESSON_REGEN || this == LAB_REGEN;
    }
}
