package com.coursegen.core.stage;

import com.coursegen.core.config.CoursegenProperties;
import com.coursegen.core.model.ErrorClass;
import com.coursegen.core.model.StageName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Nested
    @DisplayName("RetryPolicy")
    class Policy {

        @Test
        @DisplayName("Defaults retry timeouts and transient rejections three times")
        void defaults() {
            var policy = RetryPolicy.defaults();

            assertEquals(3, policy.maxAttempts());
            assertEquals(Duration.ofSeconds(2), policy.baseDelay());
            assertTrue(policy.isRetryable(ErrorClass.TIMEOUT));
            assertTrue(policy.isRetryable(ErrorClass.TRANSIENT_REJECTION));
            assertFalse(policy.isRetryable(ErrorClass.MALFORMED_INPUT));
            assertFalse(policy.isRetryable(ErrorClass.UNKNOWN));
            assertFalse(policy.hasCallTimeout());
        }

        @Test
        @DisplayName("Delay grows geometrically")
        void backoff() {
            var policy = RetryPolicy.defaults();

            assertEquals(Duration.ofSeconds(2), policy.delayBeforeRetry(1));
            assertEquals(Duration.ofSeconds(4), policy.delayBeforeRetry(2));
            assertEquals(Duration.ofSeconds(8), policy.delayBeforeRetry(3));
            assertEquals(Duration.ZERO, policy.delayBeforeRetry(0));
        }

        @Test
        @DisplayName("Merge conflicts are never retried, even when listed")
        void mergeConflictNeverRetried() {
            var policy = new RetryPolicy(3, Duration.ofMillis(10), 2.0,
                    Set.of(ErrorClass.MERGE_CONFLICT, ErrorClass.TIMEOUT), Set.of(), Duration.ZERO);

            assertFalse(policy.isRetryable(ErrorClass.MERGE_CONFLICT));
            assertTrue(policy.isRetryable(ErrorClass.TIMEOUT));
        }

        @Test
        @DisplayName("Non-retryable wins over retryable")
        void nonRetryableWins() {
            var policy = new RetryPolicy(3, Duration.ofMillis(10), 2.0,
                    Set.of(ErrorClass.TIMEOUT), Set.of(ErrorClass.TIMEOUT), Duration.ZERO);

            assertFalse(policy.isRetryable(ErrorClass.TIMEOUT));
        }

        @Test
        @DisplayName("Rejects invalid settings")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().withMaxAttempts(0));
            assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, Duration.ofSeconds(1), 0.5,
                    Set.of(), Set.of(), Duration.ZERO));
        }

        @Test
        @DisplayName("Zero base delay is raised to one millisecond")
        void minimumDelay() {
            assertEquals(Duration.ofMillis(1), RetryPolicy.defaults().withBaseDelay(Duration.ZERO).baseDelay());
        }
    }

    @Nested
    @DisplayName("RetryPolicies")
    class Policies {

        @Test
        @DisplayName("Stage overrides inherit unset fields from the defaults")
        void stageOverridesInherit() {
            var props = new CoursegenProperties();
            props.getRetry().getDefaults().setMaxAttempts(4);
            props.getRetry().getDefaults().setBaseDelay(Duration.ofMillis(500));
            var imagePolicy = new CoursegenProperties.StagePolicy();
            imagePolicy.setMaxAttempts(2);
            imagePolicy.setCallTimeout(Duration.ofSeconds(120));
            props.getRetry().getStages().put("image-render", imagePolicy);

            var policies = new RetryPolicies(props);

            var content = policies.policyFor(StageName.CONTENT);
            assertEquals(4, content.maxAttempts());
            assertEquals(Duration.ofMillis(500), content.baseDelay());

            var image = policies.policyFor(StageName.IMAGE_RENDER);
            assertEquals(2, image.maxAttempts());
            assertEquals(Duration.ofMillis(500), image.baseDelay());
            assertEquals(Duration.ofSeconds(120), image.callTimeout());
        }

        @Test
        @DisplayName("Stage keys accept enum names")
        void enumNameKeys() {
            var props = new CoursegenProperties();
            var assembly = new CoursegenProperties.StagePolicy();
            assembly.setMaxAttempts(1);
            props.getRetry().getStages().put("ASSEMBLY", assembly);

            assertEquals(1, new RetryPolicies(props).policyFor(StageName.ASSEMBLY).maxAttempts());
        }

        @Test
        @DisplayName("Unknown stage keys are rejected")
        void unknownStage() {
            var props = new CoursegenProperties();
            props.getRetry().getStages().put("painting", new CoursegenProperties.StagePolicy());

            assertThrows(IllegalArgumentException.class, () -> new RetryPolicies(props));
        }
    }
}
