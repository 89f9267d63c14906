package com.coursegen.core.orchestrator;

import com.coursegen.core.model.ContentEntry;
import com.coursegen.core.model.ImageBinding;
import com.coursegen.core.model.StageError;
import com.coursegen.core.model.StageName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one unit's stage pipeline produced, before it is committed.
 *
 * @param failedStage   the stage that failed, or {@code null}
 * @param error         that stage's final error, or {@code null}
 * @param entries       entries to commit, image ids already bound
 * @param images        bindings for those entries
 * @param remainingRefs refs an interrupted stage did not reach
 */
record PipelineRun(
    StageName failedStage,
    StageError error,
    List<ContentEntry> entries,
    Map<Integer, ImageBinding> images,
    List<String> remainingRefs
) {

    PipelineRun {
        entries = List.copyOf(entries);
        images = Collections.unmodifiableMap(new LinkedHashMap<>(images));
        remainingRefs = List.copyOf(remainingRefs);
    }

    static PipelineRun failed(StageName stage, StageError error) {
        return new PipelineRun(stage, error, List.of(), Map.of(), List.of());
    }

    static PipelineRun finished(List<ContentEntry> entries, Map<Integer, ImageBinding> images,
                                List<String> remainingRefs) {
        return new PipelineRun(null, null, entries, images, remainingRefs);
    }

    boolean isFailed() {
        return failedStage != null;
    }

    boolean isPartial() {
        return !isFailed() && !remainingRefs.isEmpty();
    }
}
