package com.coursegen.core.nodes;

import com.coursegen.core.events.EventBus;
import com.coursegen.core.events.GenerationEvent;
import com.coursegen.core.metrics.GenerationMetrics;
import com.coursegen.core.model.AssemblyReport;
import com.coursegen.core.model.RunState;
import com.coursegen.core.model.RunStatus;
import com.coursegen.core.model.StageName;
import com.coursegen.core.model.StageStatus;
import com.coursegen.core.model.UnitOutcome;
import com.coursegen.core.model.UnitStatus;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.orchestrator.ActiveRun;
import com.coursegen.core.orchestrator.ActiveRunRegistry;
import com.coursegen.core.stage.StageContext;
import com.coursegen.core.stage.StageWorkerAdapter;
import com.coursegen.core.state.GenerationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Last node: persists pending work, runs document assembly when this invocation
 * completed the artifact, and decides the final run status.
 * <ul>
 *   <li>{@code FAILED}: structural error, any failed unit, or a fail-fast abort</li>
 *   <li>{@code PARTIALLY_COMPLETED}: deferred or continuation units remain</li>
 *   <li>{@code COMPLETED}: the artifact is complete</li>
 * </ul>
 */
@Component
public class FinalizeRunNode {

    private static final Logger log = LoggerFactory.getLogger(FinalizeRunNode.class);

    private final StageWorkerAdapter adapter;
    private final ActiveRunRegistry registry;
    private final EventBus eventBus;
    private final GenerationMetrics metrics;

    @Autowired
    public FinalizeRunNode(StageWorkerAdapter adapter, ActiveRunRegistry registry, EventBus eventBus,
                           GenerationMetrics metrics) {
        this.adapter = adapter;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    FinalizeRunNode(StageWorkerAdapter adapter, ActiveRunRegistry registry, EventBus eventBus) {
        this(adapter, registry, eventBus, null);
    }

    public Map<String, Object> apply(GenerationState state) {
        String runId = state.runId();
        if (state.hasStructuralErrors()) {
            finish(runId, RunStatus.FAILED, Map.of("errors", state.structuralErrors()));
            return Map.of("status", RunStatus.FAILED.name());
        }

        ActiveRun run = registry.require(runId);
        List<WorkUnit> pending = state.pendingUnits();
        RunState artifact = run.ledger().recordPending(pending);
        var updates = new HashMap<String, Object>();
        var warnings = new ArrayList<String>();

        if (shouldAssemble(state, artifact, pending)) {
            var context = StageContext.of(runId, state.outline().orElseThrow(),
                    state.generationContext().orElseThrow(), run.guard(), artifact);
            AssemblyReport report = AssemblyReport.from(adapter.invokeRunStage(StageName.ASSEMBLY, context));
            if (report.status() != StageStatus.OK) {
                String detail = report.error() != null
                        ? report.error().message()
                        : report.remainingRefs().size() + " section(s) not reached";
                warnings.add("Document assembly " + report.status().name().toLowerCase(Locale.ROOT) + ": " + detail);
            }
            updates.put("assembly", report);
        }

        if (run.isAborted()) {
            warnings.add("Run aborted: " + run.abortReason());
        }
        if (run.isCancelled()) {
            warnings.add("Run cancelled; queued units were deferred");
        }

        List<UnitOutcome> outcomes = state.unitOutcomes();
        long failed = outcomes.stream().filter(o -> o.status() == UnitStatus.FAILED).count();
        RunStatus status;
        if (failed > 0 || run.isAborted()) {
            status = RunStatus.FAILED;
        } else if (!pending.isEmpty() || !artifact.isComplete()) {
            status = RunStatus.PARTIALLY_COMPLETED;
        } else {
            status = RunStatus.COMPLETED;
        }

        log.info("Run {} finished {}: {}/{} units complete, {} failed, {} pending",
                runId, status, artifact.unitsCompleted(), artifact.unitsTotal(), failed, pending.size());
        finish(runId, status, Map.of(
                "unitsCompleted", artifact.unitsCompleted(),
                "unitsTotal", artifact.unitsTotal(),
                "failed", failed,
                "pending", pending.stream().map(WorkUnit::unitId).toList()));

        updates.put("status", status.name());
        updates.put("artifact", artifact);
        updates.put("warnings", warnings);
        return updates;
    }

    /**
     * Assembly runs for the one merge that completed the artifact, or when a resume finds
     * a complete artifact with nothing left to dispatch.
     */
    private static boolean shouldAssemble(GenerationState state, RunState artifact, List<WorkUnit> pending) {
        if (state.unitOutcomes().stream().anyMatch(UnitOutcome::readyForAssembly)) {
            return true;
        }
        return state.resume() && state.units().isEmpty() && pending.isEmpty() && artifact.isComplete();
    }

    private void finish(String runId, RunStatus status, Map<String, Object> payload) {
        eventBus.publish(GenerationEvent.ofRunFinished(runId, status, payload));
        if (metrics != null) {
            metrics.recordRunResult(status.name());
        }
    }
}
