package com.coursegen.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for course generation runs.
 */
@Service
public class GenerationMetrics {

    private final MeterRegistry registry;

    public GenerationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordUnitDuration(String kind, String status, long ms) {
        Timer.builder("coursegen.unit.duration")
                .tag("kind", kind)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records how many attempts one stage invocation took, tagged by its final status.
     */
    public void recordStageAttempts(String stage, String status, int attempts) {
        DistributionSummary.builder("coursegen.stage.attempts")
                .description("Attempts per stage invocation, including the first")
                .tag("stage", stage)
                .tag("status", status)
                .register(registry)
                .record(attempts);
    }

    public void recordRunResult(String status) {
        Counter.builder("coursegen.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordGuardYield(String stage) {
        Counter.builder("coursegen.guard.yields")
                .description("Stages that returned partial output because the time budget ran low")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    /**
     * Records refs a merge ignored because the artifact already held them.
     */
    public void recordMergeSkipped(int refs) {
        Counter.builder("coursegen.merge.skipped")
                .description("Refs skipped on merge because an entry already existed")
                .register(registry)
                .increment(refs);
    }

    public void recordDeferredUnits(String reason, int count) {
        Counter.builder("coursegen.units.deferred")
                .tag("reason", reason)
                .register(registry)
                .increment(count);
    }
}
