package com.coursegen.core.timeout;

import com.coursegen.core.config.CoursegenProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Creates one {@link TimeoutGuard} per invocation from the configured budget and margin.
 */
@Component
public class TimeoutGuardFactory {

    private final Duration usableBudget;
    private final Clock clock;

    @Autowired
    public TimeoutGuardFactory(CoursegenProperties properties, Clock clock) {
        this(properties.getTimeout().getBudget(), properties.getTimeout().getSafetyMargin(), clock);
    }

    public TimeoutGuardFactory(Duration budget, Duration safetyMargin, Clock clock) {
        Duration usable = budget.minus(safetyMargin);
        this.usableBudget = usable.isNegative() ? Duration.ZERO : usable;
        this.clock = clock;
    }

    public TimeoutGuard newGuard() {
        return new TimeoutGuard(usableBudget, clock);
    }

    public Duration usableBudget() {
        return usableBudget;
    }
}
