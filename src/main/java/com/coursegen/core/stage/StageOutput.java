package com.coursegen.core.stage;

import com.coursegen.core.model.StagePayload;

import java.util.List;

/**
 * What a {@link StageWorker} returns from one successful call.
 */
public record StageOutput(StagePayload payload, boolean partial) {

    public static StageOutput complete(StagePayload payload) {
        return new StageOutput(payload, false);
    }

    /**
     * Output of an interrupted stage: {@code payload} covers completed sub-steps only.
     */
    public static StageOutput partial(StagePayload payload, List<String> remainingRefs) {
        return new StageOutput(payload.withRemainingRefs(remainingRefs), true);
    }
}
