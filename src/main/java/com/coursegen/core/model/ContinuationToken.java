package com.coursegen.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Identifies the work units a follow-up invocation of {@code runId} will dispatch.
 */
public record ContinuationToken(String runId, List<String> unitIds) implements Serializable {

    public ContinuationToken {
        unitIds = unitIds == null ? List.of() : List.copyOf(unitIds);
    }
}
