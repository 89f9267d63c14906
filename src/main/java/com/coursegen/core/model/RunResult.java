package com.coursegen.core.model;

import java.util.List;

/**
 * What a caller gets back from one invocation.
 * <ul>
 *   <li>{@code COMPLETED}: {@code artifact} holds the full content</li>
 *   <li>{@code PARTIALLY_COMPLETED}: {@code continuation} lists the units still to run</li>
 *   <li>{@code FAILED}: {@code failures} lists every failed unit with its refs and final error</li>
 * </ul>
 */
public record RunResult(
    String runId,
    RunStatus status,
    RunScope scope,
    RunState artifact,
    ContinuationToken continuation,
    List<UnitFailure> failures,
    List<String> warnings,
    AssemblyReport assembly
) {

    public RunResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<String> failedRefs() {
        return failures.stream().flatMap(f -> f.targetRefs().stream()).toList();
    }
}
