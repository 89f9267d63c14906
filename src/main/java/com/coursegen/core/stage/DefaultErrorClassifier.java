package com.coursegen.core.stage;

import com.coursegen.core.accumulator.MergeConflictException;
import com.coursegen.core.generation.GenerationServiceException;
import com.coursegen.core.model.ErrorClass;
import com.coursegen.core.outline.StructuralValidationException;
import com.coursegen.core.storage.ArtifactStoreException;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.reflect.UndeclaredThrowableException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies failures from generation calls and artifact writes.
 * Anything unrecognized is {@link ErrorClass#UNKNOWN}, which the default policy does not retry.
 */
@Component
public class DefaultErrorClassifier implements ErrorClassifier {

    @Override
    public ErrorClass classify(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof GenerationServiceException gse) {
            return gse.errorClass();
        }
        if (t instanceof MergeConflictException) {
            return ErrorClass.MERGE_CONFLICT;
        }
        if (t instanceof TimeoutException || t instanceof SocketTimeoutException
                || t instanceof HttpTimeoutException) {
            return ErrorClass.TIMEOUT;
        }
        if (t instanceof TransientAiException) {
            return ErrorClass.TRANSIENT_REJECTION;
        }
        if (t instanceof NonTransientAiException) {
            return ErrorClass.POLICY_REJECTION;
        }
        if (t instanceof StructuralValidationException || t instanceof IllegalArgumentException) {
            return ErrorClass.MALFORMED_INPUT;
        }
        if (t instanceof ArtifactStoreException || t instanceof IOException) {
            return ErrorClass.TRANSIENT_REJECTION;
        }
        return ErrorClass.UNKNOWN;
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException
                || t instanceof UndeclaredThrowableException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
