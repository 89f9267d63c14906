package com.coursegen.core.nodes;

import com.coursegen.core.config.CoursegenProperties;
import com.coursegen.core.model.GenerationContext;
import com.coursegen.core.model.GenerationRequest;
import com.coursegen.core.model.RunState;
import com.coursegen.core.model.RunStatus;
import com.coursegen.core.outline.OutlineParser;
import com.coursegen.core.outline.StructuralValidationException;
import com.coursegen.core.persistence.RunStateStore;
import com.coursegen.core.routing.RegenerationRouter;
import com.coursegen.core.state.GenerationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * First node: decides the run scope, resolves the generation context and loads the outline.
 * A resumed run takes all of these from its stored state.
 */
@Component
public class RouteRequestNode {

    private static final Logger log = LoggerFactory.getLogger(RouteRequestNode.class);

    private final RegenerationRouter router;
    private final OutlineParser parser;
    private final RunStateStore store;
    private final String defaultProvider;
    private final String defaultFolder;

    @Autowired
    public RouteRequestNode(RegenerationRouter router, OutlineParser parser, RunStateStore store,
                            CoursegenProperties properties) {
        this(router, parser, store, properties.getGeneration().getModelProvider(),
                properties.getGeneration().getProjectFolder());
    }

    RouteRequestNode(RegenerationRouter router, OutlineParser parser, RunStateStore store,
                     String defaultProvider, String defaultFolder) {
        this.router = router;
        this.parser = parser;
        this.store = store;
        this.defaultProvider = defaultProvider;
        this.defaultFolder = defaultFolder;
    }

    public Map<String, Object> apply(GenerationState state) {
        String runId = state.runId();
        try {
            return state.resume() ? routeResume(runId) : routeRequest(runId, state.request().orElseThrow(
                    () -> new StructuralValidationException("No generation request for run " + runId)));
        } catch (StructuralValidationException e) {
            log.error("Run {} rejected: {}", runId, e.problems());
            return Map.of(
                    "structuralErrors", e.problems(),
                    "status", RunStatus.FAILED.name());
        }
    }

    private Map<String, Object> routeResume(String runId) {
        RunState prior = store.find(runId).orElseThrow(() ->
                new StructuralValidationException("Run " + runId + " was not found"));
        GenerationContext context = prior.context();
        if (context == null) {
            throw new StructuralValidationException("Run " + runId + " has no stored generation context");
        }
        var outline = parser.load(context.outlineRef());
        log.info("Resuming run {} ({} scope, {} pending unit(s))", runId, prior.scope(), prior.pendingUnits().size());
        return Map.of(
                "scope", prior.scope().name(),
                "outline", outline,
                "generationContext", context,
                "status", RunStatus.SCHEDULED.name());
    }

    private Map<String, Object> routeRequest(String runId, GenerationRequest request) {
        var decision = router.route(request);
        Optional<GenerationContext> prior = decision.isNarrow()
                ? store.find(runId).map(RunState::context)
                : Optional.empty();

        String outlineRef = firstNonBlank(request.outlineRef(), prior.map(GenerationContext::outlineRef).orElse(null));
        if (outlineRef == null) {
            throw new StructuralValidationException("No outline reference given for run " + runId);
        }
        String folder = firstNonBlank(request.projectFolder(),
                prior.map(GenerationContext::projectFolder).orElse(null), defaultFolder);
        if (folder == null) {
            folder = "courses/" + runId;
        }
        String provider = firstNonBlank(request.modelProvider(),
                prior.map(GenerationContext::modelProvider).orElse(null), defaultProvider);
        var overrides = request.overrides().isEmpty()
                ? prior.map(GenerationContext::overrides).orElse(Map.of())
                : request.overrides();
        var context = new GenerationContext(outlineRef, folder, provider, overrides);

        var outline = parser.load(outlineRef);
        var updates = new HashMap<String, Object>();
        updates.put("scope", decision.scope().name());
        updates.put("outline", outline);
        updates.put("generationContext", context);
        updates.put("status", RunStatus.SCHEDULED.name());
        return updates;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }
}
