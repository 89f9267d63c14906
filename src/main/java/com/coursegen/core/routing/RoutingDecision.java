package com.coursegen.core.routing;

import com.coursegen.core.model.GenerationRequest;
import com.coursegen.core.model.RunScope;

import java.io.Serializable;
import java.util.List;

/**
 * Whether a request regenerates everything or exactly one unit.
 */
public record RoutingDecision(RunScope scope, GenerationRequest request) implements Serializable {

    public boolean isNarrow() {
        return scope == RunScope.NARROW;
    }

    public List<String> targets() {
        return request.targetRefs();
    }
}
