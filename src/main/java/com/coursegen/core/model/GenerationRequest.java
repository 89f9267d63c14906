package com.coursegen.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Incoming generation or regeneration request.
 *
 * @param runId         prior run to regenerate into, or the id to use for a new run (nullable)
 * @param outlineRef    storage key of the outline YAML
 * @param mode          {@code NEW} or {@code REGENERATE}
 * @param targetRefs    refs to regenerate; empty for a full generation
 * @param contentScope  lessons, labs or both (full generation only)
 * @param modules       1-based module numbers to restrict a full generation to; empty for all
 * @param modelProvider generation-service selection; blank uses the configured default
 * @param projectFolder artifact prefix; blank derives one from the run id
 * @param overrides     style and requirements overrides
 */
public record GenerationRequest(
    String runId,
    String outlineRef,
    GenerationMode mode,
    List<String> targetRefs,
    ContentScope contentScope,
    List<Integer> modules,
    String modelProvider,
    String projectFolder,
    Map<String, String> overrides
) implements Serializable {

    public GenerationRequest {
        targetRefs = targetRefs == null ? List.of() : List.copyOf(targetRefs);
        modules = modules == null ? List.of() : List.copyOf(modules);
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
        if (mode == null) {
            mode = targetRefs.isEmpty() ? GenerationMode.NEW : GenerationMode.REGENERATE;
        }
        if (contentScope == null) {
            contentScope = ContentScope.ALL;
        }
    }

    public static GenerationRequest newRun(String outlineRef) {
        return new GenerationRequest(null, outlineRef, GenerationMode.NEW, List.of(), ContentScope.ALL,
                List.of(), null, null, Map.of());
    }

    public static GenerationRequest regeneration(String runId, String outlineRef, List<String> targetRefs) {
        return new GenerationRequest(runId, outlineRef, GenerationMode.REGENERATE, targetRefs, ContentScope.ALL,
                List.of(), null, null, Map.of());
    }

    public GenerationRequest withRunId(String id) {
        return new GenerationRequest(id, outlineRef, mode, targetRefs, contentScope, modules,
                modelProvider, projectFolder, overrides);
    }

    public GenerationRequest withProjectFolder(String folder) {
        return new GenerationRequest(runId, outlineRef, mode, targetRefs, contentScope, modules,
                modelProvider, folder, overrides);
    }
}
