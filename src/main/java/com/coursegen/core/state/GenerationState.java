package com.coursegen.core.state;

import com.coursegen.core.model.AssemblyReport;
import com.coursegen.core.model.GenerationContext;
import com.coursegen.core.model.GenerationRequest;
import com.coursegen.core.model.RunScope;
import com.coursegen.core.model.RunState;
import com.coursegen.core.model.RunStatus;
import com.coursegen.core.model.UnitOutcome;
import com.coursegen.core.model.UnitStatus;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.outline.CourseOutline;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one generation invocation.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Warnings and structural
 * errors use appender channels so every node can add to them. Runtime handles that are not
 * serializable (time guard, ledger) live in the {@code ActiveRunRegistry} instead.
 */
public class GenerationState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Scalar channels ──────────────────────────────────────────
        Map.entry("runId",             Channels.base(() -> "")),
        Map.entry("request",           Channels.base((Reducer<GenerationRequest>) null)),
        Map.entry("resume",            Channels.base(() -> false)),
        Map.entry("scope",             Channels.base(() -> RunScope.FULL.name())),
        Map.entry("status",            Channels.base(() -> RunStatus.SCHEDULED.name())),
        Map.entry("outline",           Channels.base((Reducer<CourseOutline>) null)),
        Map.entry("generationContext", Channels.base((Reducer<GenerationContext>) null)),
        Map.entry("units",             Channels.base((Supplier<List<WorkUnit>>) List::of)),
        Map.entry("unitOutcomes",      Channels.base((Supplier<List<UnitOutcome>>) List::of)),
        Map.entry("assembly",          Channels.base((Reducer<AssemblyReport>) null)),
        Map.entry("artifact",          Channels.base((Reducer<RunState>) null)),
        Map.entry("abortReason",       Channels.base(() -> "")),

        // ── Appender channels (list accumulation) ────────────────────
        Map.entry("warnings",          Channels.appender(ArrayList::new)),
        Map.entry("structuralErrors",  Channels.appender(ArrayList::new))
    );

    public GenerationState(Map<String, Object> initData) {
        super(initData);
    }

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public Optional<GenerationRequest> request() {
        return this.value("request");
    }

    public boolean resume() {
        return this.<Boolean>value("resume").orElse(false);
    }

    public RunScope scope() {
        return RunScope.valueOf(this.<String>value("scope").orElse(RunScope.FULL.name()));
    }

    public RunStatus status() {
        return RunStatus.valueOf(this.<String>value("status").orElse(RunStatus.SCHEDULED.name()));
    }

    public Optional<CourseOutline> outline() {
        return this.value("outline");
    }

    public Optional<GenerationContext> generationContext() {
        return this.value("generationContext");
    }

    public List<WorkUnit> units() {
        return this.<List<WorkUnit>>value("units").orElse(List.of());
    }

    public List<UnitOutcome> unitOutcomes() {
        return this.<List<UnitOutcome>>value("unitOutcomes").orElse(List.of());
    }

    public Optional<AssemblyReport> assembly() {
        return this.value("assembly");
    }

    public Optional<RunState> artifact() {
        return this.value("artifact");
    }

    public String abortReason() {
        return this.<String>value("abortReason").orElse("");
    }

    public List<String> warnings() {
        return this.<List<String>>value("warnings").orElse(List.of());
    }

    public List<String> structuralErrors() {
        return this.<List<String>>value("structuralErrors").orElse(List.of());
    }

    // ── Derived ──────────────────────────────────────────────────────

    public boolean hasStructuralErrors() {
        return !structuralErrors().isEmpty();
    }

    public List<UnitOutcome> outcomesWithStatus(UnitStatus status) {
        return unitOutcomes().stream().filter(o -> o.status() == status).toList();
    }

    /**
     * Units a follow-up invocation must run: failed and deferred units as dispatched,
     * plus the continuation of every partial unit.
     */
    public List<WorkUnit> pendingUnits() {
        var pending = new ArrayList<WorkUnit>();
        for (UnitOutcome outcome : unitOutcomes()) {
            switch (outcome.status()) {
                case FAILED, DEFERRED -> pending.add(outcome.unit());
                case PARTIAL -> pending.add(outcome.continuation());
                case COMPLETED -> { }
            }
        }
        return pending;
    }
}
