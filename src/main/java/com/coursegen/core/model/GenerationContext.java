package com.coursegen.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Immutable copy of the parameters shared by every work unit of a run.
 *
 * @param outlineRef    storage key of the source outline
 * @param projectFolder storage prefix under which artifacts are written
 * @param modelProvider generation-service selection (e.g. "openai")
 * @param overrides     style and requirements overrides passed into prompts
 */
public record GenerationContext(
    String outlineRef,
    String projectFolder,
    String modelProvider,
    Map<String, String> overrides
) implements Serializable {

    public GenerationContext {
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }
}
