package com.coursegen.core.persistence;

import com.coursegen.core.model.RunState;
import com.coursegen.core.storage.ArtifactStore;
import com.coursegen.core.storage.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Keeps each run's state as JSON next to its artifacts, at {@code runs/{runId}/run-state.json}.
 */
public class ArtifactRunStateStore implements RunStateStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactRunStateStore.class);

    private final ArtifactStore artifactStore;

    public ArtifactRunStateStore(ArtifactStore artifactStore) {
        this.artifactStore = artifactStore;
    }

    @Override
    public void save(RunState state) {
        artifactStore.putText(StorageKeys.runState(state.runId()), RunStateJson.write(state));
        log.debug("Saved run state for {} ({}/{} units, {})", state.runId(),
                state.unitsCompleted(), state.unitsTotal(), state.completionStatus());
    }

    @Override
    public Optional<RunState> find(String runId) {
        return artifactStore.getText(StorageKeys.runState(runId)).map(RunStateJson::read);
    }

    @Override
    public boolean exists(String runId) {
        return artifactStore.exists(StorageKeys.runState(runId));
    }
}
