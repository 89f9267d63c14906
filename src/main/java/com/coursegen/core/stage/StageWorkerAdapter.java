package com.coursegen.core.stage;

import com.coursegen.core.logging.MdcContext;
import com.coursegen.core.metrics.GenerationMetrics;
import com.coursegen.core.model.ErrorClass;
import com.coursegen.core.model.StageError;
import com.coursegen.core.model.StageName;
import com.coursegen.core.model.StageResult;
import com.coursegen.core.model.WorkUnit;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Uniform entry point for every stage.
 * <p>
 * Wraps each {@link StageWorker} call in a resilience4j {@link Retry} built from the stage's
 * {@link RetryPolicy}, bounds non-interruptible calls with a {@link TimeLimiter} when the policy
 * sets a call timeout, and turns the outcome into a {@link StageResult}. Failures never escape:
 * they come back as {@code FAILED} results carrying the classified final error.
 */
@Component
public class StageWorkerAdapter {

    private static final Logger log = LoggerFactory.getLogger(StageWorkerAdapter.class);

    private final Map<StageName, StageWorker> workers = new EnumMap<>(StageName.class);
    private final RetryPolicies policies;
    private final ErrorClassifier classifier;
    private final GenerationMetrics metrics;
    private final ExecutorService callExecutor;

    @Autowired
    public StageWorkerAdapter(List<StageWorker> workers, RetryPolicies policies,
                              ErrorClassifier classifier, GenerationMetrics metrics) {
        for (StageWorker worker : workers) {
            StageWorker previous = this.workers.put(worker.stage(), worker);
            if (previous != null) {
                throw new IllegalStateException("Two workers registered for stage " + worker.stage()
                        + ": " + previous.getClass().getSimpleName() + " and " + worker.getClass().getSimpleName());
            }
        }
        this.policies = policies;
        this.classifier = classifier;
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "stage-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Test constructor without metrics. */
    StageWorkerAdapter(List<StageWorker> workers, RetryPolicies policies, ErrorClassifier classifier) {
        this(workers, policies, classifier, null);
    }

    /**
     * Runs {@code stage} for one work unit.
     */
    public StageResult invoke(StageName stage, WorkUnit unit, StageContext context) {
        return run(stage, unit, unit.unitId(), context);
    }

    /**
     * Runs a run-level stage (assembly) that has no work unit.
     */
    public StageResult invokeRunStage(StageName stage, StageContext context) {
        return run(stage, null, context.runId() + ":" + stage.configKey(), context);
    }

    public boolean supports(StageName stage) {
        return workers.containsKey(stage);
    }

    public boolean interruptible(StageName stage) {
        StageWorker worker = workers.get(stage);
        return worker != null && worker.interruptible();
    }

    private StageResult run(StageName stage, WorkUnit unit, String resultId, StageContext context) {
        StageWorker worker = workers.get(stage);
        if (worker == null) {
            return StageResult.failed(resultId, stage,
                    new StageError(ErrorClass.MALFORMED_INPUT, "No worker registered for stage " + stage),
                    Duration.ZERO, 0);
        }

        RetryPolicy policy = policies.policyFor(stage);
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = Retry.of(stage.configKey() + ":" + resultId, retryConfig(policy));
        retry.getEventPublisher().onRetry(event -> log.warn(
                "Stage {} for {} failed on attempt {} ({}), retrying in {} ms",
                stage, resultId, event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown error",
                event.getWaitInterval().toMillis()));

        MdcContext.setStage(stage.configKey());
        long start = System.nanoTime();
        StageResult result;
        try {
            StageOutput output = retry.executeCallable(() -> {
                attempts.incrementAndGet();
                return call(worker, unit, context, policy);
            });
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            if (!output.partial()) {
                result = StageResult.ok(resultId, stage, output.payload(), elapsed, attempts.get());
            } else if (worker.interruptible()) {
                log.info("Stage {} for {} yielded with {} ref(s) remaining",
                        stage, resultId, output.payload().remainingRefs().size());
                if (metrics != null) {
                    metrics.recordGuardYield(stage.configKey());
                }
                result = StageResult.partial(resultId, stage, output.payload(), elapsed, attempts.get());
            } else {
                log.error("Stage {} is not interruptible but returned partial output for {}", stage, resultId);
                result = StageResult.failed(resultId, stage, new StageError(ErrorClass.UNKNOWN,
                        "Stage " + stage + " is not interruptible but returned partial output"),
                        elapsed, attempts.get());
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            Throwable cause = DefaultErrorClassifier.unwrap(e);
            ErrorClass errorClass = classifier.classify(e);
            log.error("Stage {} failed for {} after {} attempt(s) [{}]: {}",
                    stage, resultId, attempts.get(), errorClass, cause.getMessage());
            result = StageResult.failed(resultId, stage, new StageError(errorClass, describe(cause)),
                    Duration.ofNanos(System.nanoTime() - start), attempts.get());
        } finally {
            MdcContext.clearStage();
        }

        if (metrics != null) {
            metrics.recordStageAttempts(stage.configKey(), result.status().name(), result.attempts());
        }
        return result;
    }

    private RetryConfig retryConfig(RetryPolicy policy) {
        return RetryConfig.custom()
                .maxAttempts(policy.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        policy.baseDelay(), policy.backoffMultiplier()))
                .retryOnException(e -> policy.isRetryable(classifier.classify(e)))
                .build();
    }

    private StageOutput call(StageWorker worker, WorkUnit unit, StageContext context,
                             RetryPolicy policy) throws Exception {
        if (worker.interruptible() || !policy.hasCallTimeout()) {
            return worker.execute(unit, context);
        }
        TimeLimiter limiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(policy.callTimeout())
                .cancelRunningFuture(true)
                .build());
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        // A timed-out attempt is cancelled with interruption before the retry starts.
        return limiter.executeFutureSupplier(() -> callExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return worker.execute(unit, context);
            } finally {
                MDC.clear();
            }
        }));
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    @PreDestroy
    void shutdown() {
        callExecutor.shutdownNow();
    }
}
