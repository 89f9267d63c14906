package com.coursegen.core.generation;

import java.util.Map;

/**
 * Response from the generation service: text for text prompts, binary for images.
 */
public record GenerationResponse(String text, byte[] binary, Map<String, String> metadata) {

    public GenerationResponse {
        text = text == null ? "" : text;
        binary = binary == null ? new byte[0] : binary;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static GenerationResponse ofText(String text) {
        return new GenerationResponse(text, null, Map.of());
    }

    public static GenerationResponse ofBinary(byte[] binary) {
        return new GenerationResponse(null, binary, Map.of());
    }
}
