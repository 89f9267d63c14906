package com.coursegen.core.stage;

import com.coursegen.core.model.GenerationContext;
import com.coursegen.core.model.RunState;
import com.coursegen.core.model.StageName;
import com.coursegen.core.model.StageResult;
import com.coursegen.core.outline.CourseOutline;
import com.coursegen.core.timeout.TimeoutGuard;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Inputs shared by the stages of one pipeline run.
 *
 * @param runId      run identifier
 * @param outline    the parsed outline
 * @param generation shared generation parameters
 * @param guard      invocation time budget
 * @param previous   results of stages that already ran for this unit
 * @param runState   artifact snapshot taken when the unit started (revision, accumulated content)
 */
public record StageContext(
    String runId,
    CourseOutline outline,
    GenerationContext generation,
    TimeoutGuard guard,
    Map<StageName, StageResult> previous,
    RunState runState
) {

    public StageContext {
        previous = previous == null || previous.isEmpty() ? Map.of() : Map.copyOf(previous);
    }

    public static StageContext of(String runId, CourseOutline outline, GenerationContext generation,
                                  TimeoutGuard guard, RunState runState) {
        return new StageContext(runId, outline, generation, guard, Map.of(), runState);
    }

    public Optional<StageResult> previous(StageName stage) {
        return Optional.ofNullable(previous.get(stage));
    }

    public StageContext withPrevious(StageResult result) {
        var next = new EnumMap<StageName, StageResult>(StageName.class);
        next.putAll(previous);
        next.put(result.stage(), result);
        return new StageContext(runId, outline, generation, guard, next, runState);
    }

    public int revision() {
        return runState == null ? 0 : runState.revision();
    }
}
