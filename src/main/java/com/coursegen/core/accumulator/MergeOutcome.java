package com.coursegen.core.accumulator;

import com.coursegen.core.model.RunState;

import java.util.List;

/**
 * Result of merging one unit into the run artifact.
 *
 * @param state            the artifact after the merge
 * @param acceptedRefs     refs whose entries were written
 * @param skippedRefs      refs ignored because an entry already existed
 * @param readyForAssembly true only for the merge that completed the artifact
 */
public record MergeOutcome(
    RunState state,
    List<String> acceptedRefs,
    List<String> skippedRefs,
    boolean readyForAssembly
) {

    public MergeOutcome {
        acceptedRefs = List.copyOf(acceptedRefs);
        skippedRefs = List.copyOf(skippedRefs);
    }
}
