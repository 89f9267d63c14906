package com.coursegen.core.orchestrator;

import com.coursegen.core.model.ContentEntry;
import com.coursegen.core.model.ImageBinding;
import com.coursegen.core.model.StageName;
import com.coursegen.core.model.StageResult;
import com.coursegen.core.model.VisualPrompt;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.stage.PipelineVariant;
import com.coursegen.core.stage.StageContext;
import com.coursegen.core.stage.StageWorkerAdapter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one work unit through its stage sequence.
 * <p>
 * Stages run strictly in order. When the entry stage is interrupted, the remaining stages
 * run only for the refs it completed and the rest is reported as remaining.
 */
@Component
public class UnitPipeline {

    private final StageWorkerAdapter adapter;

    public UnitPipeline(StageWorkerAdapter adapter) {
        this.adapter = adapter;
    }

    PipelineRun run(WorkUnit unit, StageContext initial) {
        PipelineVariant variant = PipelineVariant.of(unit.kind());
        StageContext context = initial;
        WorkUnit current = unit;
        List<String> remaining = List.of();

        for (StageName stage : variant.stages()) {
            StageResult result = adapter.invoke(stage, current, context);
            if (result.isFailed()) {
                return PipelineRun.failed(stage, result.error());
            }
            if (result.isPartial()) {
                remaining = result.payload().remainingRefs();
                List<String> completed = result.payload().completedRefs();
                if (completed.isEmpty()) {
                    return PipelineRun.finished(List.of(), Map.of(), remaining);
                }
                current = current.narrowedTo(completed);
            }
            context = context.withPrevious(result);
        }

        List<ContentEntry> entries = context.previous(variant.entryStage())
                .map(r -> r.payload().entries())
                .orElse(List.of());
        Map<Integer, ImageBinding> images = context.previous(StageName.IMAGE_RENDER)
                .map(r -> r.payload().images())
                .orElse(Map.of());
        List<VisualPrompt> prompts = context.previous(StageName.VISUAL_PLAN)
                .map(r -> r.payload().visualPrompts())
                .orElse(List.of());
        return PipelineRun.finished(bindImages(entries, prompts), images, remaining);
    }

    boolean interruptible(StageName stage) {
        return adapter.interruptible(stage);
    }

    private static List<ContentEntry> bindImages(List<ContentEntry> entries, List<VisualPrompt> prompts) {
        if (prompts.isEmpty()) {
            return entries;
        }
        var idsByRef = new LinkedHashMap<String, List<Integer>>();
        for (VisualPrompt prompt : prompts) {
            idsByRef.computeIfAbsent(prompt.targetRef(), k -> new ArrayList<>()).add(prompt.imageId());
        }
        return entries.stream()
                .map(e -> e.withImageIds(idsByRef.getOrDefault(e.targetRef(), List.of())))
                .toList();
    }
}
