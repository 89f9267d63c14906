package com.coursegen.core.stage;

import com.coursegen.core.accumulator.MergeConflictException;
import com.coursegen.core.generation.GenerationServiceException;
import com.coursegen.core.model.ErrorClass;
import com.coursegen.core.model.ImageBinding;
import com.coursegen.core.outline.StructuralValidationException;
import com.coursegen.core.storage.ArtifactStoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class DefaultErrorClassifierTest {

    private final DefaultErrorClassifier classifier = new DefaultErrorClassifier();

    @Test
    @DisplayName("Generation service failures keep their own class")
    void generationServiceException() {
        assertEquals(ErrorClass.POLICY_REJECTION,
                classifier.classify(new GenerationServiceException(ErrorClass.POLICY_REJECTION, "blocked")));
    }

    @Test
    @DisplayName("Timeouts are TIMEOUT")
    void timeouts() {
        assertEquals(ErrorClass.TIMEOUT, classifier.classify(new TimeoutException()));
        assertEquals(ErrorClass.TIMEOUT, classifier.classify(new SocketTimeoutException("read")));
    }

    @Test
    @DisplayName("Spring AI exceptions map to transient and policy rejections")
    void springAi() {
        assertEquals(ErrorClass.TRANSIENT_REJECTION, classifier.classify(new TransientAiException("429")));
        assertEquals(ErrorClass.POLICY_REJECTION, classifier.classify(new NonTransientAiException("400")));
    }

    @Test
    @DisplayName("Structural and argument errors are malformed input")
    void malformed() {
        assertEquals(ErrorClass.MALFORMED_INPUT, classifier.classify(new StructuralValidationException("bad")));
        assertEquals(ErrorClass.MALFORMED_INPUT, classifier.classify(new IllegalArgumentException("bad")));
    }

    @Test
    @DisplayName("Storage failures are transient")
    void storage() {
        assertEquals(ErrorClass.TRANSIENT_REJECTION,
                classifier.classify(new ArtifactStoreException("disk", new IOException("full"))));
        assertEquals(ErrorClass.TRANSIENT_REJECTION, classifier.classify(new IOException("closed")));
    }

    @Test
    @DisplayName("Merge conflicts are MERGE_CONFLICT")
    void mergeConflict() {
        var e = new MergeConflictException(1, new ImageBinding("a", "d"), new ImageBinding("b", "d"));
        assertEquals(ErrorClass.MERGE_CONFLICT, classifier.classify(e));
    }

    @Test
    @DisplayName("Unwraps async wrappers before classifying")
    void unwraps() {
        var wrapped = new CompletionException(new ExecutionException(new TimeoutException()));
        assertEquals(ErrorClass.TIMEOUT, classifier.classify(wrapped));
    }

    @Test
    @DisplayName("Anything else is UNKNOWN")
    void unknown() {
        assertEquals(ErrorClass.UNKNOWN, classifier.classify(new IllegalStateException("?")));
    }
}
