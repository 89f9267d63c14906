package com.coursegen.core.persistence;

import com.coursegen.core.model.RunState;

import java.util.Optional;

/**
 * Durable storage for {@link RunState}. Saved after every merge so a later
 * invocation can resume or regenerate from the last committed artifact.
 */
public interface RunStateStore {

    void save(RunState state);

    Optional<RunState> find(String runId);

    default boolean exists(String runId) {
        return find(runId).isPresent();
    }
}
