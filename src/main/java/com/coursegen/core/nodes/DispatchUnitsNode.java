package com.coursegen.core.nodes;

import com.coursegen.core.model.RunStatus;
import com.coursegen.core.orchestrator.ActiveRunRegistry;
import com.coursegen.core.orchestrator.BatchOrchestrator;
import com.coursegen.core.state.GenerationState;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Hands the planned units to the {@link BatchOrchestrator} and records their outcomes.
 */
@Component
public class DispatchUnitsNode {

    private final BatchOrchestrator orchestrator;
    private final ActiveRunRegistry registry;

    public DispatchUnitsNode(BatchOrchestrator orchestrator, ActiveRunRegistry registry) {
        this.orchestrator = orchestrator;
        this.registry = registry;
    }

    public Map<String, Object> apply(GenerationState state) {
        var run = registry.require(state.runId());
        var outcomes = orchestrator.dispatch(state.units(), state.outline().orElseThrow(),
                state.generationContext().orElseThrow(), run);

        var updates = new HashMap<String, Object>();
        updates.put("unitOutcomes", outcomes);
        updates.put("status", RunStatus.RUNNING.name());
        if (run.isAborted()) {
            updates.put("abortReason", run.abortReason());
        }
        return updates;
    }
}
