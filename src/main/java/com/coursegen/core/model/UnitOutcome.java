package com.coursegen.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Per-unit result of one orchestrator invocation.
 * Written by {@code DispatchUnitsNode}, read by {@code FinalizeRunNode}.
 *
 * @param unit              the unit as dispatched
 * @param status            final unit status
 * @param committedRefs     refs merged into the run artifact
 * @param failedStage       stage that failed, when {@code status} is FAILED
 * @param error             final error, when {@code status} is FAILED
 * @param continuation      follow-up unit, when {@code status} is PARTIAL
 * @param elapsedMs         wall-clock time spent on the unit
 * @param readyForAssembly  true for the single unit whose merge completed the run
 */
public record UnitOutcome(
    WorkUnit unit,
    UnitStatus status,
    List<String> committedRefs,
    StageName failedStage,
    StageError error,
    WorkUnit continuation,
    long elapsedMs,
    boolean readyForAssembly
) implements Serializable {

    public UnitOutcome {
        committedRefs = committedRefs == null ? List.of() : List.copyOf(committedRefs);
    }

    public static UnitOutcome completed(WorkUnit unit, List<String> committedRefs, long elapsedMs,
                                        boolean readyForAssembly) {
        return new UnitOutcome(unit, UnitStatus.COMPLETED, committedRefs, null, null, null,
                elapsedMs, readyForAssembly);
    }

    public static UnitOutcome partial(WorkUnit unit, List<String> committedRefs, WorkUnit continuation,
                                      long elapsedMs) {
        return new UnitOutcome(unit, UnitStatus.PARTIAL, committedRefs, null, null, continuation,
                elapsedMs, false);
    }

    public static UnitOutcome failed(WorkUnit unit, StageName stage, StageError error, long elapsedMs) {
        return new UnitOutcome(unit, UnitStatus.FAILED, List.of(), stage, error, null, elapsedMs, false);
    }

    public static UnitOutcome deferred(WorkUnit unit) {
        return new UnitOutcome(unit, UnitStatus.DEFERRED, List.of(), null, null, null, 0L, false);
    }
}
