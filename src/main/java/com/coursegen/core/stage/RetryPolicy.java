package com.coursegen.core.stage;

import com.coursegen.core.model.ErrorClass;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-stage retry configuration.
 * <p>
 * Delay before retry {@code n} (1-based) is {@code baseDelay * backoffMultiplier^(n-1)}.
 * An error class is retried only when it is listed as retryable and not as non-retryable;
 * {@link ErrorClass#MERGE_CONFLICT} is never retried.
 *
 * @param maxAttempts             total attempts including the first, at least 1
 * @param baseDelay               delay before the first retry
 * @param backoffMultiplier       growth factor per retry, at least 1.0
 * @param retryableErrorClasses   classes that may be retried
 * @param nonRetryableErrorClasses classes that fail immediately
 * @param callTimeout             per-attempt limit for non-interruptible stages, zero for none
 */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    double backoffMultiplier,
    Set<ErrorClass> retryableErrorClasses,
    Set<ErrorClass> nonRetryableErrorClasses,
    Duration callTimeout
) {

    private static final Duration MIN_DELAY = Duration.ofMillis(1);

    public static final Set<ErrorClass> DEFAULT_RETRYABLE =
            Set.copyOf(EnumSet.of(ErrorClass.TIMEOUT, ErrorClass.TRANSIENT_REJECTION));

    public static final Set<ErrorClass> DEFAULT_NON_RETRYABLE = Set.copyOf(EnumSet.of(
            ErrorClass.MALFORMED_INPUT, ErrorClass.POLICY_REJECTION, ErrorClass.MERGE_CONFLICT));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0, got " + backoffMultiplier);
        }
        if (baseDelay == null || baseDelay.compareTo(MIN_DELAY) < 0) {
            baseDelay = MIN_DELAY;
        }
        retryableErrorClasses = retryableErrorClasses == null ? Set.of() : Set.copyOf(retryableErrorClasses);
        var nonRetryable = EnumSet.of(ErrorClass.MERGE_CONFLICT);
        if (nonRetryableErrorClasses != null) {
            nonRetryable.addAll(nonRetryableErrorClasses);
        }
        nonRetryableErrorClasses = Set.copyOf(nonRetryable);
        if (callTimeout == null || callTimeout.isNegative()) {
            callTimeout = Duration.ZERO;
        }
    }

    /**
     * Three attempts, 2s base delay doubling per retry, timeouts and transient
     * rejections retried, no per-call timeout.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(2), 2.0,
                DEFAULT_RETRYABLE, DEFAULT_NON_RETRYABLE, Duration.ZERO);
    }

    public boolean isRetryable(ErrorClass errorClass) {
        return retryableErrorClasses.contains(errorClass) && !nonRetryableErrorClasses.contains(errorClass);
    }

    /**
     * Delay before the given retry, 1-based.
     */
    public Duration delayBeforeRetry(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        return Duration.ofMillis((long) (baseDelay.toMillis() * Math.pow(backoffMultiplier, retry - 1)));
    }

    public boolean hasCallTimeout() {
        return !callTimeout.isZero();
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, baseDelay, backoffMultiplier,
                retryableErrorClasses, nonRetryableErrorClasses, callTimeout);
    }

    public RetryPolicy withBaseDelay(Duration delay) {
        return new RetryPolicy(maxAttempts, delay, backoffMultiplier,
                retryableErrorClasses, nonRetryableErrorClasses, callTimeout);
    }

    public RetryPolicy withCallTimeout(Duration timeout) {
        return new RetryPolicy(maxAttempts, baseDelay, backoffMultiplier,
                retryableErrorClasses, nonRetryableErrorClasses, timeout);
    }
}
