package com.coursegen.core.events;

import com.coursegen.core.model.RunStatus;

import java.io.Serializable;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * An event emitted during a generation run, consumed by the CLI and by tests.
 *
 * @param eventType event type (e.g. "run.created", "unit.started", "run.ready_for_assembly")
 * @param runId     the run this event belongs to
 * @param unitId    the work unit this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record GenerationEvent(
    String eventType,
    String runId,
    String unitId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    private static final Set<RunStatus> FINAL_STATUSES =
            EnumSet.of(RunStatus.COMPLETED, RunStatus.FAILED, RunStatus.PARTIALLY_COMPLETED);

    /**
     * The event that closes one invocation of a run, e.g. {@code run.partially_completed}.
     */
    public static GenerationEvent ofRunFinished(String runId, RunStatus status, Map<String, Object> payload) {
        return ofRun(typeOf(status), runId, payload);
    }

    public static GenerationEvent ofRun(String eventType, String runId, Map<String, Object> payload) {
        return new GenerationEvent(eventType, runId, null, payload, Instant.now());
    }

    public static GenerationEvent ofUnit(String eventType, String runId, String unitId,
                                         Map<String, Object> payload) {
        return new GenerationEvent(eventType, runId, unitId, payload, Instant.now());
    }

    /** Whether this event reports the final status of a run invocation. */
    public boolean isRunFinished() {
        return unitId == null && FINAL_STATUSES.stream().anyMatch(s -> typeOf(s).equals(eventType));
    }

    private static String typeOf(RunStatus status) {
        return "run." + status.name().toLowerCase(Locale.ROOT);
    }
}
