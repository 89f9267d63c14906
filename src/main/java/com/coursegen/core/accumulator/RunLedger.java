package com.coursegen.core.accumulator;

import com.coursegen.core.model.RunState;
import com.coursegen.core.model.UnitResult;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.persistence.RunStateStore;

import java.util.List;

/**
 * The live artifact of one invocation. Commits from concurrent units are serialized
 * here; each new state is persisted before it becomes visible.
 */
public class RunLedger {

    private final ResultAccumulator accumulator;
    private final RunStateStore store;
    private RunState current;

    RunLedger(ResultAccumulator accumulator, RunStateStore store, RunState initial) {
        this.accumulator = accumulator;
        this.store = store;
        this.current = initial;
    }

    public synchronized MergeOutcome commit(UnitResult result) {
        MergeOutcome outcome = accumulator.merge(current, result);
        store.save(outcome.state());
        current = outcome.state();
        return outcome;
    }

    /**
     * Records the units a follow-up invocation must pick up.
     */
    public synchronized RunState recordPending(List<WorkUnit> pending) {
        RunState next = current.withPendingUnits(pending);
        store.save(next);
        current = next;
        return next;
    }

    public synchronized RunState current() {
        return current;
    }
}
