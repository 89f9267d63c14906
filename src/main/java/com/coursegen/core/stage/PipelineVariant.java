package com.coursegen.core.stage;

import com.coursegen.core.model.StageName;
import com.coursegen.core.model.WorkUnitKind;

import java.util.List;

/**
 * Stage sequence for each kind of work unit.
 */
public enum PipelineVariant {

    LESSON(List.of(StageName.CONTENT, StageName.VISUAL_PLAN, StageName.IMAGE_RENDER), StageName.CONTENT),
    LAB(List.of(StageName.LAB_PLAN, StageName.LAB_WRITE), StageName.LAB_WRITE);

    private final List<StageName> stages;
    private final StageName entryStage;

    PipelineVariant(List<StageName> stages, StageName entryStage) {
        this.stages = stages;
        this.entryStage = entryStage;
    }

    public static PipelineVariant of(WorkUnitKind kind) {
        return kind.isLab() ? LAB : LESSON;
    }

    public List<StageName> stages() {
        return stages;
    }

    /** The stage whose entries are committed to the run artifact. */
    public StageName entryStage() {
        return entryStage;
    }
}
