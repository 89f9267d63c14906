package com.coursegen.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of the single document-assembly call made when a run completes.
 */
public record AssemblyReport(
    StageStatus status,
    String documentKey,
    List<String> remainingRefs,
    StageError error
) implements Serializable {

    public AssemblyReport {
        remainingRefs = remainingRefs == null ? List.of() : List.copyOf(remainingRefs);
    }

    public static AssemblyReport from(StageResult result) {
        return new AssemblyReport(result.status(), result.payload().documentKey(),
                result.payload().remainingRefs(), result.error());
    }
}
