package com.coursegen.core.model;

import java.time.Duration;

/**
 * Outcome of one stage for one work unit.
 * {@code error} is present iff {@code status} is {@link StageStatus#FAILED};
 * a failed result never carries payload.
 */
public record StageResult(
    String unitId,
    StageName stage,
    StageStatus status,
    StagePayload payload,
    StageError error,
    Duration elapsed,
    int attempts
) {

    public static StageResult ok(String unitId, StageName stage, StagePayload payload,
                                 Duration elapsed, int attempts) {
        return new StageResult(unitId, stage, StageStatus.OK, payload, null, elapsed, attempts);
    }

    public static StageResult partial(String unitId, StageName stage, StagePayload payload,
                                      Duration elapsed, int attempts) {
        return new StageResult(unitId, stage, StageStatus.PARTIAL, payload, null, elapsed, attempts);
    }

    public static StageResult failed(String unitId, StageName stage, StageError error,
                                     Duration elapsed, int attempts) {
        return new StageResult(unitId, stage, StageStatus.FAILED, StagePayload.empty(), error, elapsed, attempts);
    }

    public boolean isFailed() {
        return status == StageStatus.FAILED;
    }

    public boolean isPartial() {
        return status == StageStatus.PARTIAL;
    }
}
