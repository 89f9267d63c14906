package com.coursegen.core.outline;

import com.coursegen.core.model.ContentScope;
import com.coursegen.core.model.GenerationContext;
import com.coursegen.core.model.GenerationMode;

import java.util.List;

public record DecompositionRequest(
    GenerationMode mode,
    List<String> targetRefs,
    ContentScope contentScope,
    List<Integer> modules,
    GenerationContext context
) {

    public DecompositionRequest {
        targetRefs = targetRefs == null ? List.of() : List.copyOf(targetRefs);
        modules = modules == null ? List.of() : List.copyOf(modules);
        contentScope = contentScope == null ? ContentScope.ALL : contentScope;
    }

    public static DecompositionRequest full(GenerationContext context) {
        return new DecompositionRequest(GenerationMode.NEW, List.of(), ContentScope.ALL, List.of(), context);
    }

    public static DecompositionRequest regenerate(List<String> targetRefs, GenerationContext context) {
        return new DecompositionRequest(GenerationMode.REGENERATE, targetRefs, ContentScope.ALL, List.of(), context);
    }
}
