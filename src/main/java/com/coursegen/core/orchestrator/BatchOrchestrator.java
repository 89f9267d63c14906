package com.coursegen.core.orchestrator;

import com.coursegen.core.accumulator.MergeConflictException;
import com.coursegen.core.accumulator.MergeOutcome;
import com.coursegen.core.config.CoursegenProperties;
import com.coursegen.core.events.EventBus;
import com.coursegen.core.events.GenerationEvent;
import com.coursegen.core.logging.MdcContext;
import com.coursegen.core.metrics.GenerationMetrics;
import com.coursegen.core.model.ErrorClass;
import com.coursegen.core.model.GenerationContext;
import com.coursegen.core.model.StageError;
import com.coursegen.core.model.UnitOutcome;
import com.coursegen.core.model.UnitResult;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.outline.CourseOutline;
import com.coursegen.core.stage.DefaultErrorClassifier;
import com.coursegen.core.stage.ErrorClassifier;
import com.coursegen.core.stage.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs work units through their pipelines on a fixed pool of {@code maxConcurrent} threads.
 * <p>
 * Units are queued in the given order. Before a unit starts, the run's cancel flag, abort flag
 * and time guard are checked; a stopped unit is reported {@code DEFERRED}. A failed unit never
 * stops its siblings unless its error is fail-fast, in which case the run is aborted and every
 * unit still queued is deferred. Results are committed through the run's ledger as each unit
 * finishes.
 */
@Component
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final UnitPipeline pipeline;
    private final int maxConcurrent;
    private final Set<ErrorClass> failFastErrorClasses;
    private final ErrorClassifier classifier;
    private final EventBus eventBus;
    private final GenerationMetrics metrics;

    @Autowired
    public BatchOrchestrator(UnitPipeline pipeline, CoursegenProperties properties, ErrorClassifier classifier,
                             EventBus eventBus, GenerationMetrics metrics) {
        this(pipeline, properties.getOrchestrator().getMaxConcurrent(),
                properties.getOrchestrator().getFailFastErrorClasses(), classifier, eventBus, metrics);
    }

    BatchOrchestrator(UnitPipeline pipeline, int maxConcurrent, Set<ErrorClass> failFastErrorClasses) {
        this(pipeline, maxConcurrent, failFastErrorClasses, new DefaultErrorClassifier(), new EventBus(), null);
    }

    BatchOrchestrator(UnitPipeline pipeline, int maxConcurrent, Set<ErrorClass> failFastErrorClasses,
                      ErrorClassifier classifier, EventBus eventBus, GenerationMetrics metrics) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        this.pipeline = pipeline;
        this.maxConcurrent = maxConcurrent;
        this.failFastErrorClasses = failFastErrorClasses == null || failFastErrorClasses.isEmpty()
                ? EnumSet.noneOf(ErrorClass.class) : EnumSet.copyOf(failFastErrorClasses);
        this.classifier = classifier;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Dispatches {@code units} and waits for all of them.
     *
     * @return one outcome per unit, in the order given
     */
    public List<UnitOutcome> dispatch(List<WorkUnit> units, CourseOutline outline, GenerationContext generation,
                                      ActiveRun run) {
        if (units.isEmpty()) {
            return List.of();
        }
        String runId = run.runId();
        log.info("Dispatching {} unit(s) for run {} (maxConcurrent={})", units.size(), runId, maxConcurrent);
        eventBus.publish(GenerationEvent.ofRun("run.running", runId,
                Map.of("units", units.size(), "maxConcurrent", maxConcurrent)));

        var counter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(maxConcurrent, units.size()), r -> {
            Thread t = new Thread(r, "unit-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            var futures = new ArrayList<CompletableFuture<UnitOutcome>>();
            for (WorkUnit unit : units) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> runUnit(unit, outline, generation, run), executor));
            }
            var outcomes = new ArrayList<UnitOutcome>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).join());
                } catch (CompletionException e) {
                    log.error("Unexpected error collecting outcome for unit {}", units.get(i).unitId(), e);
                    outcomes.add(UnitOutcome.failed(units.get(i), null,
                            new StageError(classifier.classify(e), String.valueOf(e.getCause())), 0L));
                }
            }
            return outcomes;
        } finally {
            executor.shutdown();
        }
    }

    private UnitOutcome runUnit(WorkUnit unit, CourseOutline outline, GenerationContext generation, ActiveRun run) {
        String runId = run.runId();
        MdcContext.setUnit(runId, unit.unitId());
        try {
            String stopReason = run.stopReason();
            if (stopReason != null) {
                log.warn("Deferring unit {} ({})", unit.unitId(), stopReason);
                publish("unit.deferred", runId, unit, Map.of("reason", stopReason));
                if (metrics != null) {
                    metrics.recordDeferredUnits(stopReason, 1);
                }
                return UnitOutcome.deferred(unit);
            }

            publish("unit.started", runId, unit, Map.of("kind", unit.kind().name(), "refs", unit.targetRefs()));
            long start = System.currentTimeMillis();
            UnitOutcome outcome = execute(unit, outline, generation, run, start);
            if (metrics != null) {
                metrics.recordUnitDuration(unit.kind().name(), outcome.status().name(), outcome.elapsedMs());
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Infrastructure error running unit {}: {}", unit.unitId(), e.getMessage(), e);
            var error = new StageError(classifier.classify(e), String.valueOf(e.getMessage()));
            publish("unit.failed", runId, unit, Map.of("errorClass", error.errorClass().name()));
            return UnitOutcome.failed(unit, null, error, 0L);
        } finally {
            MdcContext.clearUnit();
        }
    }

    private UnitOutcome execute(WorkUnit unit, CourseOutline outline, GenerationContext generation,
                                ActiveRun run, long start) {
        String runId = run.runId();
        var context = StageContext.of(runId, outline, generation, run.guard(), run.ledger().current());
        PipelineRun result = pipeline.run(unit, context);

        if (result.isFailed()) {
            long elapsed = System.currentTimeMillis() - start;
            StageError error = result.error();
            log.error("Unit {} failed at stage {} [{}]: {}", unit.unitId(), result.failedStage(),
                    error.errorClass(), error.message());
            if (!pipeline.interruptible(result.failedStage()) && failFastErrorClasses.contains(error.errorClass())) {
                abort(run, "unit " + unit.unitId() + " failed at " + result.failedStage()
                        + " with " + error.errorClass());
            }
            publish("unit.failed", runId, unit, Map.of(
                    "stage", result.failedStage().name(), "errorClass", error.errorClass().name()));
            return UnitOutcome.failed(unit, result.failedStage(), error, elapsed);
        }

        MergeOutcome merged;
        try {
            merged = run.ledger().commit(new UnitResult(unit.unitId(), unit.originUnitId(),
                    result.entries(), result.images(), !result.isPartial()));
        } catch (MergeConflictException e) {
            log.error("Unit {} conflicts with the run artifact: {}", unit.unitId(), e.getMessage());
            abort(run, "merge conflict in unit " + unit.unitId());
            publish("unit.failed", runId, unit, Map.of("errorClass", ErrorClass.MERGE_CONFLICT.name()));
            return UnitOutcome.failed(unit, null, new StageError(ErrorClass.MERGE_CONFLICT, e.getMessage()),
                    System.currentTimeMillis() - start);
        }
        long elapsed = System.currentTimeMillis() - start;

        if (result.isPartial()) {
            WorkUnit continuation = unit.continuation(result.remainingRefs());
            log.warn("Unit {} committed {} ref(s); {} continues with {}", unit.unitId(),
                    merged.acceptedRefs().size(), continuation.unitId(), continuation.targetRefs());
            publish("unit.partial", runId, unit, Map.of(
                    "committed", merged.acceptedRefs(), "continuation", continuation.unitId()));
            return UnitOutcome.partial(unit, merged.acceptedRefs(), continuation, elapsed);
        }

        log.info("Unit {} completed in {}ms ({} ref(s) committed, {} skipped)", unit.unitId(), elapsed,
                merged.acceptedRefs().size(), merged.skippedRefs().size());
        publish("unit.completed", runId, unit, Map.of("committed", merged.acceptedRefs(), "elapsedMs", elapsed));
        if (merged.readyForAssembly()) {
            log.info("Run {} artifact is complete; ready for assembly", runId);
            eventBus.publish(GenerationEvent.ofRun("run.ready_for_assembly", runId,
                    Map.of("entries", merged.state().accumulatedContent().size(),
                           "images", merged.state().imageBindings().size())));
        }
        return UnitOutcome.completed(unit, merged.acceptedRefs(), elapsed, merged.readyForAssembly());
    }

    private void abort(ActiveRun run, String reason) {
        if (!run.isAborted()) {
            log.error("Aborting run {}: {}", run.runId(), reason);
        }
        run.abort(reason);
    }

    private void publish(String type, String runId, WorkUnit unit, Map<String, Object> payload) {
        var data = new HashMap<String, Object>(payload);
        data.put("originUnitId", unit.originUnitId());
        eventBus.publish(GenerationEvent.ofUnit(type, runId, unit.unitId(), data));
    }
}
