package com.coursegen.core.outline;

import com.coursegen.core.model.WorkUnit;

import java.util.List;

/**
 * Ordered work units for one run, plus any non-fatal outline warnings.
 */
public record Decomposition(List<WorkUnit> units, List<String> warnings) {

    public Decomposition {
        units = List.copyOf(units);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
