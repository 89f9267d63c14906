package com.coursegen.core.orchestrator;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs currently executing in this process, keyed by run id.
 */
@Component
public class ActiveRunRegistry {

    private final ConcurrentHashMap<String, ActiveRun> runs = new ConcurrentHashMap<>();

    public void register(ActiveRun run) {
        ActiveRun existing = runs.putIfAbsent(run.runId(), run);
        if (existing != null) {
            throw new IllegalStateException("Run " + run.runId() + " is already executing");
        }
    }

    public Optional<ActiveRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public ActiveRun require(String runId) {
        return find(runId).orElseThrow(() -> new IllegalStateException("Run " + runId + " is not executing"));
    }

    public List<String> runIds() {
        return List.copyOf(runs.keySet());
    }

    public void remove(String runId) {
        runs.remove(runId);
    }
}
