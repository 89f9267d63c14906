package com.coursegen.core.outline;

import java.util.List;

/**
 * Thrown when an outline or request is structurally unusable. Fatal and never retried;
 * surfaced to the caller before any stage executes.
 */
public class StructuralValidationException extends RuntimeException {

    private final List<String> problems;

    public StructuralValidationException(String problem) {
        this(List.of(problem));
    }

    public StructuralValidationException(List<String> problems) {
        super("Structural validation failed: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public StructuralValidationException(String problem, Throwable cause) {
        super("Structural validation failed: " + problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> problems() {
        return problems;
    }
}
