package com.coursegen.core.nodes;

import com.coursegen.core.accumulator.ResultAccumulator;
import com.coursegen.core.model.RunState;
import com.coursegen.core.model.RunStatus;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.orchestrator.ActiveRun;
import com.coursegen.core.orchestrator.ActiveRunRegistry;
import com.coursegen.core.outline.StructuralValidationException;
import com.coursegen.core.persistence.RunStateStore;
import com.coursegen.core.routing.RegenerationRouter;
import com.coursegen.core.routing.RoutingDecision;
import com.coursegen.core.state.GenerationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Decomposes the outline into work units, prepares the artifact for this pass
 * and attaches its ledger to the active run. Nothing is persisted when planning fails.
 */
@Component
public class PlanUnitsNode {

    private static final Logger log = LoggerFactory.getLogger(PlanUnitsNode.class);

    private final RegenerationRouter router;
    private final RunStateStore store;
    private final ResultAccumulator accumulator;
    private final ActiveRunRegistry registry;

    public PlanUnitsNode(RegenerationRouter router, RunStateStore store, ResultAccumulator accumulator,
                         ActiveRunRegistry registry) {
        this.router = router;
        this.store = store;
        this.accumulator = accumulator;
        this.registry = registry;
    }

    public Map<String, Object> apply(GenerationState state) {
        String runId = state.runId();
        ActiveRun run = registry.require(runId);
        var outline = state.outline().orElseThrow();
        var context = state.generationContext().orElseThrow();
        try {
            List<WorkUnit> units;
            List<String> warnings;
            if (state.resume()) {
                RunState prior = store.find(runId).orElseThrow(() ->
                        new StructuralValidationException("Run " + runId + " was not found"));
                units = prior.pendingUnits();
                warnings = outline.warnings();
                run.attach(accumulator.open(prior));
            } else {
                var decision = new RoutingDecision(state.scope(), state.request().orElseThrow());
                var decomposition = router.plan(decision, outline, context);
                RunState artifact = router.prepareArtifact(decision, runId, store.find(runId),
                        decomposition.units().size(), context);
                units = decomposition.units();
                warnings = decomposition.warnings();
                run.attach(accumulator.open(artifact));
            }
            log.info("Planned {} unit(s) for run {}: {}", units.size(), runId,
                    units.stream().map(WorkUnit::unitId).toList());
            return Map.of(
                    "units", units,
                    "warnings", warnings,
                    "status", RunStatus.SCHEDULED.name());
        } catch (StructuralValidationException e) {
            log.error("Planning failed for run {}: {}", runId, e.problems());
            return Map.of(
                    "structuralErrors", e.problems(),
                    "status", RunStatus.FAILED.name());
        }
    }
}
