package com.coursegen.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage-specific output carried by a {@link StageResult}.
 *
 * @param entries        generated lessons, lab plans or lab guides
 * @param visualPrompts  prompts planned from lesson visual tags
 * @param images         rendered image bindings keyed by image id
 * @param remainingRefs  refs an interrupted stage did not reach
 * @param documentKey    storage key of an assembled document
 */
public record StagePayload(
    List<ContentEntry> entries,
    List<VisualPrompt> visualPrompts,
    Map<Integer, ImageBinding> images,
    List<String> remainingRefs,
    String documentKey
) {

    public StagePayload {
        entries = entries == null ? List.of() : List.copyOf(entries);
        visualPrompts = visualPrompts == null ? List.of() : List.copyOf(visualPrompts);
        images = images == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(images));
        remainingRefs = remainingRefs == null ? List.of() : List.copyOf(remainingRefs);
    }

    public static StagePayload empty() {
        return new StagePayload(List.of(), List.of(), Map.of(), List.of(), null);
    }

    public static StagePayload ofEntries(List<ContentEntry> entries) {
        return new StagePayload(entries, List.of(), Map.of(), List.of(), null);
    }

    public static StagePayload ofVisualPrompts(List<VisualPrompt> prompts) {
        return new StagePayload(List.of(), prompts, Map.of(), List.of(), null);
    }

    public static StagePayload ofImages(Map<Integer, ImageBinding> images) {
        return new StagePayload(List.of(), List.of(), images, List.of(), null);
    }

    public static StagePayload ofDocument(String documentKey) {
        return new StagePayload(List.of(), List.of(), Map.of(), List.of(), documentKey);
    }

    public StagePayload withRemainingRefs(List<String> refs) {
        return new StagePayload(entries, visualPrompts, images, refs, documentKey);
    }

    public List<String> completedRefs() {
        return entries.stream().map(ContentEntry::targetRef).toList();
    }
}
