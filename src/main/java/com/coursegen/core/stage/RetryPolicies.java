package com.coursegen.core.stage;

import com.coursegen.core.config.CoursegenProperties;
import com.coursegen.core.model.StageName;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves the {@link RetryPolicy} for each stage from {@code coursegen.retry.*}.
 * Stage overrides inherit every unset field from the configured defaults.
 */
@Component
public class RetryPolicies {

    private final RetryPolicy defaults;
    private final Map<StageName, RetryPolicy> byStage;

    @Autowired
    public RetryPolicies(CoursegenProperties properties) {
        var retry = properties.getRetry();
        this.defaults = merge(RetryPolicy.defaults(), retry.getDefaults());
        this.byStage = new EnumMap<>(StageName.class);
        for (var entry : retry.getStages().entrySet()) {
            byStage.put(StageName.fromConfigKey(entry.getKey()), merge(defaults, entry.getValue()));
        }
    }

    public RetryPolicies(RetryPolicy defaults, Map<StageName, RetryPolicy> overrides) {
        this.defaults = defaults;
        this.byStage = overrides.isEmpty() ? new EnumMap<>(StageName.class) : new EnumMap<>(overrides);
    }

    public static RetryPolicies uniform(RetryPolicy policy) {
        return new RetryPolicies(policy, Map.of());
    }

    public RetryPolicy policyFor(StageName stage) {
        return byStage.getOrDefault(stage, defaults);
    }

    private static RetryPolicy merge(RetryPolicy base, CoursegenProperties.StagePolicy override) {
        if (override == null) {
            return base;
        }
        return new RetryPolicy(
                override.getMaxAttempts() != null ? override.getMaxAttempts() : base.maxAttempts(),
                override.getBaseDelay() != null ? override.getBaseDelay() : base.baseDelay(),
                override.getBackoffMultiplier() != null ? override.getBackoffMultiplier() : base.backoffMultiplier(),
                override.getRetryable() != null ? override.getRetryable() : base.retryableErrorClasses(),
                override.getNonRetryable() != null ? override.getNonRetryable() : base.nonRetryableErrorClasses(),
                override.getCallTimeout() != null ? override.getCallTimeout() : base.callTimeout());
    }
}
