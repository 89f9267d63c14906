package com.coursegen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The canonical, accumulating artifact of one run.
 * <p>
 * Immutable value; every change is produced by
 * {@link com.coursegen.core.accumulator.ResultAccumulator}. Content is keyed by
 * target ref in arrival order and never holds two entries for the same ref.
 *
 * @param runId              run identifier
 * @param scope              full generation or narrow regeneration pass
 * @param revision           incremented by every regeneration pass
 * @param unitsTotal         units expected across every pass so far
 * @param completedUnitIds   completion ids of units whose pipeline finished; only grows within a run
 * @param accumulatedContent generated lessons and labs keyed by ref
 * @param imageBindings      rendered images keyed by numeric id
 * @param completionStatus   {@code PARTIAL} until every expected unit reported
 * @param replacementTargets refs a narrow pass may still overwrite
 * @param pendingUnits       work left for a follow-up invocation
 * @param context            generation parameters the run was started with
 */
public record RunState(
    String runId,
    RunScope scope,
    int revision,
    int unitsTotal,
    List<String> completedUnitIds,
    Map<String, ContentEntry> accumulatedContent,
    Map<Integer, ImageBinding> imageBindings,
    CompletionStatus completionStatus,
    List<String> replacementTargets,
    List<WorkUnit> pendingUnits,
    GenerationContext context
) implements Serializable {

    public RunState {
        completedUnitIds = completedUnitIds == null ? List.of() : List.copyOf(completedUnitIds);
        accumulatedContent = accumulatedContent == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(accumulatedContent));
        imageBindings = imageBindings == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(imageBindings));
        replacementTargets = replacementTargets == null ? List.of() : List.copyOf(replacementTargets);
        pendingUnits = pendingUnits == null ? List.of() : List.copyOf(pendingUnits);
        if (completionStatus == null) {
            completionStatus = CompletionStatus.PARTIAL;
        }
    }

    /**
     * Creates the empty artifact for a full generation pass.
     */
    public static RunState start(String runId, int unitsTotal, GenerationContext context) {
        return new RunState(runId, RunScope.FULL, 0, unitsTotal, List.of(), Map.of(), Map.of(),
                CompletionStatus.PARTIAL, List.of(), List.of(), context);
    }

    public int unitsCompleted() {
        return completedUnitIds.size();
    }

    @JsonIgnore
    public boolean isComplete() {
        return completionStatus == CompletionStatus.COMPLETE;
    }

    /**
     * Re-opens this artifact for a narrow pass that replaces {@code targets}.
     * Every other entry is carried over untouched. The completed units of earlier passes
     * are kept and the pass adds one expected unit, so {@link #unitsCompleted()} never drops.
     */
    public RunState reopenForReplacement(List<String> targets) {
        return new RunState(runId, RunScope.NARROW, revision + 1, unitsTotal + 1, completedUnitIds,
                accumulatedContent, imageBindings, CompletionStatus.PARTIAL, targets, List.of(), context);
    }

    /**
     * The id a finished unit is counted under. Units of a regeneration pass are qualified
     * by revision, so regenerating the same ref twice counts as two completions.
     */
    public String completionId(String originUnitId) {
        return revision == 0 ? originUnitId : originUnitId + "@rev-" + revision;
    }

    public RunState withPendingUnits(List<WorkUnit> units) {
        return new RunState(runId, scope, revision, unitsTotal, completedUnitIds, accumulatedContent,
                imageBindings, completionStatus, replacementTargets, units, context);
    }
}
