package com.coursegen.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GenerationMetricsTest {

    private SimpleMeterRegistry registry;
    private GenerationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new GenerationMetrics(registry);
    }

    @Test
    @DisplayName("recordUnitDuration creates a timer per kind and status")
    void recordUnitDuration() {
        metrics.recordUnitDuration("LESSON_BATCH", "COMPLETED", 1500);
        metrics.recordUnitDuration("LESSON_BATCH", "COMPLETED", 500);
        metrics.recordUnitDuration("LAB_BATCH", "FAILED", 100);

        var lessons = registry.find("coursegen.unit.duration")
                .tag("kind", "LESSON_BATCH").tag("status", "COMPLETED").timer();
        assertNotNull(lessons);
        assertEquals(2, lessons.count());
        assertEquals(2000.0, lessons.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("recordStageAttempts records a distribution per stage")
    void recordStageAttempts() {
        metrics.recordStageAttempts("content", "OK", 1);
        metrics.recordStageAttempts("content", "OK", 3);

        var summary = registry.find("coursegen.stage.attempts").tag("stage", "content").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(3.0, summary.max());
    }

    @Test
    @DisplayName("recordRunResult increments by status tag")
    void recordRunResult() {
        metrics.recordRunResult("COMPLETED");
        metrics.recordRunResult("COMPLETED");
        metrics.recordRunResult("FAILED");

        assertEquals(2.0, registry.find("coursegen.runs.total").tag("status", "COMPLETED").counter().count());
        assertEquals(1.0, registry.find("coursegen.runs.total").tag("status", "FAILED").counter().count());
    }

    @Test
    @DisplayName("guard yields, merge skips and deferrals are counted")
    void counters() {
        metrics.recordGuardYield("content");
        metrics.recordMergeSkipped(3);
        metrics.recordDeferredUnits("time-budget", 2);

        assertEquals(1.0, registry.find("coursegen.guard.yields").tag("stage", "content").counter().count());
        assertEquals(3.0, registry.find("coursegen.merge.skipped").counter().count());
        assertEquals(2.0, registry.find("coursegen.units.deferred").tag("reason", "time-budget").counter().count());
    }
}
