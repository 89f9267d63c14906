package com.coursegen.core.generation;

/**
 * Opaque generation service: returns text or binary output for a prompt.
 * Implementations throw {@link GenerationServiceException} (or any other exception,
 * classified by the stage adapter) on failure.
 */
public interface GenerationService {

    GenerationResponse generate(GenerationPrompt prompt);
}
