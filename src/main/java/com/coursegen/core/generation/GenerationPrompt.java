package com.coursegen.core.generation;

import java.util.Map;

/**
 * Request sent to the generation service.
 *
 * @param kind        text or image
 * @param system      role instructions (ignored for images)
 * @param prompt      the prompt or context
 * @param constraints stage, provider and target ref, passed through as metadata
 */
public record GenerationPrompt(
    GenerationKind kind,
    String system,
    String prompt,
    Map<String, String> constraints
) {

    public static final String STAGE = "stage";
    public static final String PROVIDER = "provider";
    public static final String TARGET_REF = "targetRef";

    public GenerationPrompt {
        constraints = constraints == null ? Map.of() : Map.copyOf(constraints);
    }

    public static GenerationPrompt text(String system, String prompt, Map<String, String> constraints) {
        return new GenerationPrompt(GenerationKind.TEXT, system, prompt, constraints);
    }

    public static GenerationPrompt image(String prompt, Map<String, String> constraints) {
        return new GenerationPrompt(GenerationKind.IMAGE, "", prompt, constraints);
    }

    public String constraint(String key) {
        return constraints.getOrDefault(key, "");
    }
}
