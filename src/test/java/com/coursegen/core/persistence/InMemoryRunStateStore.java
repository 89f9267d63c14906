package com.coursegen.core.persistence;

import com.coursegen.core.model.RunState;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link RunStateStore} for tests. Keeps every saved version so tests can check
 * what was persisted and in which order.
 */
public class InMemoryRunStateStore implements RunStateStore {

    private final Map<String, RunState> latest = new ConcurrentHashMap<>();
    private final List<RunState> history = new CopyOnWriteArrayList<>();

    @Override
    public void save(RunState state) {
        latest.put(state.runId(), state);
        history.add(state);
    }

    @Override
    public Optional<RunState> find(String runId) {
        return Optional.ofNullable(latest.get(runId));
    }

    public List<RunState> history() {
        return List.copyOf(history);
    }

    public int saveCount() {
        return history.size();
    }
}
