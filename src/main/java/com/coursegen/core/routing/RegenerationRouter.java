package com.coursegen.core.routing;

import com.coursegen.core.model.CompletionStatus;
import com.coursegen.core.model.GenerationContext;
import com.coursegen.core.model.GenerationMode;
import com.coursegen.core.model.GenerationRequest;
import com.coursegen.core.model.RunScope;
import com.coursegen.core.model.RunState;
import com.coursegen.core.outline.CourseOutline;
import com.coursegen.core.outline.Decomposition;
import com.coursegen.core.outline.DecompositionRequest;
import com.coursegen.core.outline.OutlineDecomposer;
import com.coursegen.core.outline.StructuralValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sends a request down the full-generation path or narrows it to a single
 * regeneration unit, and prepares the artifact that pass merges into.
 */
@Component
public class RegenerationRouter {

    private static final Logger log = LoggerFactory.getLogger(RegenerationRouter.class);

    private final OutlineDecomposer decomposer;

    public RegenerationRouter(OutlineDecomposer decomposer) {
        this.decomposer = decomposer;
    }

    public RoutingDecision route(GenerationRequest request) {
        boolean narrow = request.mode() == GenerationMode.REGENERATE || !request.targetRefs().isEmpty();
        if (narrow && request.targetRefs().isEmpty()) {
            throw new StructuralValidationException("Regeneration requires at least one target ref");
        }
        var decision = new RoutingDecision(narrow ? RunScope.NARROW : RunScope.FULL, request);
        log.info("Routed request for run {} to {} scope{}", request.runId(), decision.scope(),
                narrow ? " targeting " + request.targetRefs() : "");
        return decision;
    }

    /**
     * Work units for the decision: every in-scope unit for a full pass, exactly one for a narrow pass.
     */
    public Decomposition plan(RoutingDecision decision, CourseOutline outline, GenerationContext context) {
        if (decision.isNarrow()) {
            return narrow(decision, outline, context);
        }
        var request = decision.request();
        return decomposer.decompose(outline, new DecompositionRequest(GenerationMode.NEW, List.of(),
                request.contentScope(), request.modules(), context));
    }

    public Decomposition narrow(RoutingDecision decision, CourseOutline outline, GenerationContext context) {
        return decomposer.decompose(outline, DecompositionRequest.regenerate(decision.targets(), context));
    }

    /**
     * The artifact a pass merges into.
     * <ul>
     *   <li>Full pass: a new empty artifact sized to {@code unitsTotal}.</li>
     *   <li>Narrow pass over a completed run: that run re-opened with the targets as replacement targets.</li>
     *   <li>Narrow pass with no prior run: a fresh artifact for the single unit.</li>
     * </ul>
     *
     * @throws StructuralValidationException if a full pass reuses an existing run id or a
     *                                       narrow pass targets a run that is not complete
     */
    public RunState prepareArtifact(RoutingDecision decision, String runId, Optional<RunState> prior,
                                    int unitsTotal, GenerationContext context) {
        if (!decision.isNarrow()) {
            if (prior.isPresent()) {
                throw new StructuralValidationException("Run " + runId + " already exists; resume it instead");
            }
            return RunState.start(runId, unitsTotal, context);
        }
        if (prior.isEmpty()) {
            log.info("No prior artifact for run {}; regenerating {} into a fresh artifact", runId, decision.targets());
            return new RunState(runId, RunScope.NARROW, 0, 1, List.of(), Map.of(), Map.of(),
                    CompletionStatus.PARTIAL, decision.targets(), List.of(), context);
        }
        RunState state = prior.get();
        if (!state.isComplete()) {
            throw new StructuralValidationException("Run " + runId + " is not complete ("
                    + state.unitsCompleted() + "/" + state.unitsTotal() + " units); resume it before regenerating");
        }
        return state.reopenForReplacement(decision.targets());
    }
}
