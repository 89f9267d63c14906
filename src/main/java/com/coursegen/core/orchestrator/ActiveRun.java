package com.coursegen.core.orchestrator;

import com.coursegen.core.accumulator.RunLedger;
import com.coursegen.core.timeout.TimeoutGuard;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runtime handles of one invocation that cannot live in graph state:
 * the time guard, the live ledger and the stop flags.
 */
public class ActiveRun {

    private final String runId;
    private final TimeoutGuard guard;
    private volatile RunLedger ledger;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<String> abortReason = new AtomicReference<>();

    public ActiveRun(String runId, TimeoutGuard guard) {
        this.runId = runId;
        this.guard = guard;
    }

    public ActiveRun(String runId, TimeoutGuard guard, RunLedger ledger) {
        this(runId, guard);
        this.ledger = ledger;
    }

    public String runId() { return runId; }
    public TimeoutGuard guard() { return guard; }

    /** Attached once the artifact for this pass has been prepared. */
    public void attach(RunLedger ledger) {
        this.ledger = ledger;
    }

    public RunLedger ledger() {
        RunLedger current = ledger;
        if (current == null) {
            throw new IllegalStateException("Run " + runId + " has no artifact ledger yet");
        }
        return current;
    }

    public boolean hasLedger() {
        return ledger != null;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Fail-fast: no further unit starts. The first reason wins. */
    public void abort(String reason) {
        abortReason.compareAndSet(null, reason);
    }

    public boolean isAborted() {
        return abortReason.get() != null;
    }

    public String abortReason() {
        return abortReason.get();
    }

    /**
     * Why a queued unit must not start, or {@code null} if it may.
     */
    public String stopReason() {
        if (cancelled.get()) {
            return "cancelled";
        }
        if (abortReason.get() != null) {
            return "aborted";
        }
        if (guard.shouldYield()) {
            return "time-budget";
        }
        return null;
    }
}
