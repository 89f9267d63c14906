package com.coursegen.core.config;

import com.coursegen.core.model.ErrorClass;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "coursegen")
public class CoursegenProperties {

    private Orchestrator orchestrator = new Orchestrator();
    private Timeout timeout = new Timeout();
    private Retry retry = new Retry();
    private Generation generation = new Generation();
    private Storage storage = new Storage();

    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }
    public Timeout getTimeout() { return timeout; }
    public void setTimeout(Timeout timeout) { this.timeout = timeout; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Generation getGeneration() { return generation; }
    public void setGeneration(Generation generation) { this.generation = generation; }
    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }

    public static class Orchestrator {
        private int maxConcurrent = 2;
        private int maxLessonsPerBatch = 3;
        private int maxLabsPerBatch = 1;
        private Set<ErrorClass> failFastErrorClasses = EnumSet.of(ErrorClass.MALFORMED_INPUT);

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
        public int getMaxLessonsPerBatch() { return maxLessonsPerBatch; }
        public void setMaxLessonsPerBatch(int maxLessonsPerBatch) { this.maxLessonsPerBatch = maxLessonsPerBatch; }
        public int getMaxLabsPerBatch() { return maxLabsPerBatch; }
        public void setMaxLabsPerBatch(int maxLabsPerBatch) { this.maxLabsPerBatch = maxLabsPerBatch; }
        public Set<ErrorClass> getFailFastErrorClasses() { return failFastErrorClasses; }
        public void setFailFastErrorClasses(Set<ErrorClass> failFastErrorClasses) { this.failFastErrorClasses = failFastErrorClasses; }
    }

    /**
     * Invocation budget. Stages and dispatch yield once {@code budget - safetyMargin} has elapsed.
     */
    public static class Timeout {
        private Duration budget = Duration.ofSeconds(900);
        private Duration safetyMargin = Duration.ofSeconds(60);

        public Duration getBudget() { return budget; }
        public void setBudget(Duration budget) { this.budget = budget; }
        public Duration getSafetyMargin() { return safetyMargin; }
        public void setSafetyMargin(Duration safetyMargin) { this.safetyMargin = safetyMargin; }
    }

    /**
     * Default retry policy plus per-stage overrides keyed by stage config key
     * ({@code content}, {@code visual-plan}, {@code image-render}, ...).
     */
    public static class Retry {
        private StagePolicy defaults = new StagePolicy();
        private Map<String, StagePolicy> stages = new HashMap<>();

        public StagePolicy getDefaults() { return defaults; }
        public void setDefaults(StagePolicy defaults) { this.defaults = defaults; }
        public Map<String, StagePolicy> getStages() { return stages; }
        public void setStages(Map<String, StagePolicy> stages) { this.stages = stages; }
    }

    /**
     * Retry settings for one stage. Unset fields inherit from {@link Retry#getDefaults()}.
     */
    public static class StagePolicy {
        private Integer maxAttempts;
        private Duration baseDelay;
        private Double backoffMultiplier;
        private Duration callTimeout;
        private Set<ErrorClass> retryable;
        private Set<ErrorClass> nonRetryable;

        public Integer getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(Integer maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }
        public Double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(Double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public Duration getCallTimeout() { return callTimeout; }
        public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }
        public Set<ErrorClass> getRetryable() { return retryable; }
        public void setRetryable(Set<ErrorClass> retryable) { this.retryable = retryable; }
        public Set<ErrorClass> getNonRetryable() { return nonRetryable; }
        public void setNonRetryable(Set<ErrorClass> nonRetryable) { this.nonRetryable = nonRetryable; }
    }

    public static class Generation {
        private String modelProvider = "openai";
        private int maxImagesPerLesson = 6;
        private String projectFolder = "";

        public String getModelProvider() { return modelProvider; }
        public void setModelProvider(String modelProvider) { this.modelProvider = modelProvider; }
        public int getMaxImagesPerLesson() { return maxImagesPerLesson; }
        public void setMaxImagesPerLesson(int maxImagesPerLesson) { this.maxImagesPerLesson = maxImagesPerLesson; }
        public String getProjectFolder() { return projectFolder; }
        public void setProjectFolder(String projectFolder) { this.projectFolder = projectFolder; }
    }

    public static class Storage {
        private String root = "./artifacts";

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
    }
}
