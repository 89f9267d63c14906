package com.coursegen.core.generation;

import com.coursegen.core.model.ErrorClass;

/**
 * Failure reported by a generation call, carrying its own classification.
 */
public class GenerationServiceException extends RuntimeException {

    private final ErrorClass errorClass;

    public GenerationServiceException(ErrorClass errorClass, String message) {
        super(message);
        this.errorClass = errorClass;
    }

    public GenerationServiceException(ErrorClass errorClass, String message, Throwable cause) {
        super(message, cause);
        this.errorClass = errorClass;
    }

    public ErrorClass errorClass() {
        return errorClass;
    }
}
