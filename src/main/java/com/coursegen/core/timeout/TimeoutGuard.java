package com.coursegen.core.timeout;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-invocation wall-clock monitor.
 * <p>
 * Built with the usable budget (invocation budget minus safety margin). Long-running
 * stages call {@link #shouldYield()} before each sub-step and return partial output once
 * it is true. Yielding is latched: once true within an invocation it stays true.
 */
public class TimeoutGuard {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean yielded = new AtomicBoolean(false);

    public TimeoutGuard(Duration budget, Clock clock) {
        if (budget.isNegative()) {
            throw new IllegalArgumentException("Budget must not be negative: " + budget);
        }
        this.clock = clock;
        this.deadline = clock.instant().plus(budget);
    }

    /**
     * Budget left before the guard yields; never negative.
     */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean shouldYield() {
        return shouldYield(Duration.ZERO);
    }

    /**
     * Whether a sub-step expected to take {@code nextStepEstimate} should not be started.
     */
    public boolean shouldYield(Duration nextStepEstimate) {
        if (yielded.get()) {
            return true;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        if (left.isNegative() || left.isZero() || left.compareTo(nextStepEstimate) < 0) {
            yielded.set(true);
            return true;
        }
        return false;
    }

    /** Latches the guard so every later check yields. */
    public void trip() {
        yielded.set(true);
    }

    public boolean hasYielded() {
        return yielded.get();
    }
}
