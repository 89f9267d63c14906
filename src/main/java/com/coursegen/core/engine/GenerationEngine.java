package com.coursegen.core.engine;

import com.coursegen.core.events.EventBus;
import com.coursegen.core.events.GenerationEvent;
import com.coursegen.core.graph.GenerationGraph;
import com.coursegen.core.logging.MdcContext;
import com.coursegen.core.model.ContinuationToken;
import com.coursegen.core.model.GenerationRequest;
import com.coursegen.core.model.RunResult;
import com.coursegen.core.model.RunState;
import com.coursegen.core.model.UnitFailure;
import com.coursegen.core.model.UnitOutcome;
import com.coursegen.core.model.UnitStatus;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.orchestrator.ActiveRun;
import com.coursegen.core.orchestrator.ActiveRunRegistry;
import com.coursegen.core.outline.StructuralValidationException;
import com.coursegen.core.persistence.RunStateStore;
import com.coursegen.core.state.GenerationState;
import com.coursegen.core.timeout.TimeoutGuardFactory;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts, regenerates, resumes and cancels runs by bridging requests to the {@link GenerationGraph}.
 * <p>
 * Each invocation registers an {@link ActiveRun} holding its time guard for the duration
 * of the graph call. A structural error surfaces as {@link StructuralValidationException}
 * before any stage executes; every other outcome is reported through {@link RunResult}.
 */
@Service
public class GenerationEngine {

    private static final Logger log = LoggerFactory.getLogger(GenerationEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final GenerationGraph graph;
    private final ActiveRunRegistry registry;
    private final TimeoutGuardFactory guardFactory;
    private final RunStateStore store;
    private final EventBus eventBus;
    private final Clock clock;

    public GenerationEngine(GenerationGraph graph, ActiveRunRegistry registry, TimeoutGuardFactory guardFactory,
                            RunStateStore store, EventBus eventBus, Clock clock) {
        this.graph = graph;
        this.registry = registry;
        this.guardFactory = guardFactory;
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Runs a full generation, or a narrow regeneration when the request names targets.
     * A new run id is assigned when the request carries none.
     */
    public RunResult generate(GenerationRequest request) {
        String runId = request.runId() != null && !request.runId().isBlank()
                ? request.runId()
                : generateRunId();
        var stateMap = new HashMap<String, Object>();
        stateMap.put("runId", runId);
        stateMap.put("request", request.withRunId(runId));
        stateMap.put("resume", false);
        return invoke(runId, stateMap, Map.of(
                "mode", request.mode().name(),
                "targets", request.targetRefs()));
    }

    /**
     * Regenerates {@code targetRefs} inside the completed run {@code runId}.
     * A blank {@code outlineRef} reuses the outline the run was generated from.
     */
    public RunResult regenerate(String runId, String outlineRef, List<String> targetRefs) {
        return generate(GenerationRequest.regeneration(runId, outlineRef, targetRefs));
    }

    /**
     * Dispatches the units a previous invocation of {@code runId} left pending.
     */
    public RunResult resume(String runId) {
        var stateMap = new HashMap<String, Object>();
        stateMap.put("runId", runId);
        stateMap.put("resume", true);
        return invoke(runId, stateMap, Map.of("resume", true));
    }

    /**
     * Requests cancellation of a run executing in this process. Units already started
     * finish; queued units are deferred.
     *
     * @return {@code false} if the run is not executing here
     */
    public boolean cancel(String runId) {
        Optional<ActiveRun> run = registry.find(runId);
        run.ifPresent(r -> {
            log.warn("Cancellation requested for run {}", runId);
            r.cancel();
            eventBus.publish(GenerationEvent.ofRun("run.cancel_requested", runId, Map.of()));
        });
        return run.isPresent();
    }

    /**
     * Requests cancellation of every run executing in this process.
     *
     * @return the ids of the runs that were asked to stop
     */
    public List<String> cancelAll() {
        return registry.runIds().stream().filter(this::cancel).toList();
    }

    public Optional<RunState> status(String runId) {
        return store.find(runId);
    }

    private RunResult invoke(String runId, Map<String, Object> stateMap, Map<String, Object> eventPayload) {
        MdcContext.setRun(runId);
        registry.register(new ActiveRun(runId, guardFactory.newGuard()));
        try {
            log.info("Starting run {} {}", runId, eventPayload);
            eventBus.publish(GenerationEvent.ofRun("run.created", runId, eventPayload));

            var config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            var state = graph.getCompiledGraph()
                    .invoke(Map.copyOf(stateMap), config)
                    .orElseThrow(() ->
                            new IllegalStateException("Graph execution returned empty state for run " + runId));

            if (state.hasStructuralErrors()) {
                throw new StructuralValidationException(state.structuralErrors());
            }
            return toResult(runId, state);
        } finally {
            registry.remove(runId);
            MdcContext.clear();
        }
    }

    private static RunResult toResult(String runId, GenerationState state) {
        List<UnitFailure> failures = state.outcomesWithStatus(UnitStatus.FAILED).stream()
                .map(GenerationEngine::toFailure)
                .toList();
        List<WorkUnit> pending = state.pendingUnits();
        ContinuationToken continuation = pending.isEmpty()
                ? null
                : new ContinuationToken(runId, pending.stream().map(WorkUnit::unitId).toList());
        return new RunResult(runId, state.status(), state.scope(), state.artifact().orElse(null),
                continuation, failures, state.warnings(), state.assembly().orElse(null));
    }

    private static UnitFailure toFailure(UnitOutcome outcome) {
        return new UnitFailure(outcome.unit().unitId(), outcome.unit().targetRefs(), outcome.failedStage(),
                outcome.error().errorClass(), outcome.error().message());
    }

    /**
     * Generates a run id in the format CGEN-YYYY-NNNN, skipping ids already in the store.
     */
    public String generateRunId() {
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        String id;
        do {
            id = String.format("CGEN-%d-%04d", year, RUN_COUNTER.incrementAndGet());
        } while (store.exists(id));
        return id;
    }
}
