package com.coursegen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * A bounded slice of outline content that runs through one stage pipeline.
 * <p>
 * Units are immutable. A retry re-submits the same instance; an interrupted unit
 * is continued by a new unit that shares its {@code originUnitId} and covers only
 * the refs that remain.
 *
 * @param unitId       stable identifier, unique within a run
 * @param kind         lesson or lab, batch or regeneration
 * @param targetRefs   ordered lesson/lab refs this unit covers
 * @param context      shared run parameters
 * @param originUnitId the unit this one continues, or {@code unitId} itself
 */
public record WorkUnit(
    String unitId,
    WorkUnitKind kind,
    List<String> targetRefs,
    GenerationContext context,
    String originUnitId
) implements Serializable {

    private static final String SEGMENT_SEPARATOR = "~";

    public WorkUnit {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(kind, "kind");
        if (targetRefs == null || targetRefs.isEmpty()) {
            throw new IllegalArgumentException("Work unit " + unitId + " must cover at least one ref");
        }
        targetRefs = List.copyOf(targetRefs);
        if (originUnitId == null || originUnitId.isBlank()) {
            originUnitId = unitId;
        }
    }

    public WorkUnit(String unitId, WorkUnitKind kind, List<String> targetRefs, GenerationContext context) {
        this(unitId, kind, targetRefs, context, unitId);
    }

    @JsonIgnore
    public boolean isContinuation() {
        return !unitId.equals(originUnitId);
    }

    /**
     * Builds the follow-up unit that covers {@code remainingRefs}.
     * Segments are numbered from 2: {@code m01-lessons-1~2}, {@code m01-lessons-1~3}, ...
     */
    public WorkUnit continuation(List<String> remainingRefs) {
        int segment = 1;
        int idx = unitId.lastIndexOf(SEGMENT_SEPARATOR);
        if (idx >= 0) {
            segment = Integer.parseInt(unitId.substring(idx + 1));
        }
        return new WorkUnit(originUnitId + SEGMENT_SEPARATOR + (segment + 1),
                kind, remainingRefs, context, originUnitId);
    }

    /**
     * Returns a copy restricted to {@code refs}, keeping the same identity.
     * Used to run downstream stages over the sub-steps an interrupted stage completed.
     */
    public WorkUnit narrowedTo(List<String> refs) {
        return new WorkUnit(unitId, kind, refs, context, originUnitId);
    }
}
