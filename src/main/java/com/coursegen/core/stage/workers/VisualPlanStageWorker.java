package com.coursegen.core.stage.workers;

import com.coursegen.core.config.CoursegenProperties;
import com.coursegen.core.generation.GenerationPrompt;
import com.coursegen.core.generation.GenerationService;
import com.coursegen.core.model.ContentEntry;
import com.coursegen.core.model.StageName;
import com.coursegen.core.model.StagePayload;
import com.coursegen.core.model.StageResult;
import com.coursegen.core.model.VisualPrompt;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.stage.StageContext;
import com.coursegen.core.stage.StageOutput;
import com.coursegen.core.stage.StageWorker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Turns the {@code [VISUAL: ...]} tags of freshly written lessons into image prompts.
 */
@Component
public class VisualPlanStageWorker implements StageWorker {

    private final GenerationService generationService;
    private final int maxImagesPerLesson;

    @Autowired
    public VisualPlanStageWorker(GenerationService generationService, CoursegenProperties properties) {
        this(generationService, properties.getGeneration().getMaxImagesPerLesson());
    }

    VisualPlanStageWorker(GenerationService generationService, int maxImagesPerLesson) {
        this.generationService = generationService;
        this.maxImagesPerLesson = maxImagesPerLesson;
    }

    @Override
    public StageName stage() {
        return StageName.VISUAL_PLAN;
    }

    @Override
    public StageOutput execute(WorkUnit unit, StageContext context) {
        StageResult content = context.previous(StageName.CONTENT).orElseThrow(() ->
                new IllegalStateException("Visual planning for " + unit.unitId() + " ran without content output"));

        var prompts = new ArrayList<VisualPrompt>();
        for (ContentEntry entry : content.payload().entries()) {
            var lesson = context.outline().findLesson(entry.targetRef()).orElseThrow();
            var tags = VisualTags.extract(entry.text(), maxImagesPerLesson);
            for (int i = 0; i < tags.size(); i++) {
                String description = tags.get(i);
                var response = generationService.generate(GenerationPrompt.text(
                        PromptTemplates.VISUAL_SYSTEM,
                        PromptTemplates.visual(lesson, description),
                        PromptTemplates.constraints(StageName.VISUAL_PLAN, entry.targetRef(), context.generation())));
                String prompt = response.text().isBlank() ? description : response.text().strip();
                prompts.add(new VisualPrompt(VisualTags.imageId(entry.targetRef(), i + 1),
                        entry.targetRef(), description, prompt));
            }
        }
        return StageOutput.complete(StagePayload.ofVisualPrompts(prompts));
    }
}
