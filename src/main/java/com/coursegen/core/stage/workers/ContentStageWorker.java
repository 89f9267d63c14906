package com.coursegen.core.stage.workers;

import com.coursegen.core.generation.GenerationPrompt;
import com.coursegen.core.generation.GenerationService;
import com.coursegen.core.generation.GenerationServiceException;
import com.coursegen.core.model.ContentEntry;
import com.coursegen.core.model.ContentKind;
import com.coursegen.core.model.ErrorClass;
import com.coursegen.core.model.StageName;
import com.coursegen.core.model.StagePayload;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.outline.OutlineLesson;
import com.coursegen.core.outline.OutlineModule;
import com.coursegen.core.stage.StageContext;
import com.coursegen.core.stage.StageOutput;
import com.coursegen.core.stage.StageWorker;
import com.coursegen.core.storage.ArtifactStore;
import com.coursegen.core.storage.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes lesson markdown, one generation call per lesson.
 * <p>
 * Interruptible: checks the time budget before each lesson and returns the lessons
 * written so far once the budget runs low.
 */
@Component
public class ContentStageWorker implements StageWorker {

    private static final Logger log = LoggerFactory.getLogger(ContentStageWorker.class);

    private final GenerationService generationService;
    private final ArtifactStore artifactStore;

    public ContentStageWorker(GenerationService generationService, ArtifactStore artifactStore) {
        this.generationService = generationService;
        this.artifactStore = artifactStore;
    }

    @Override
    public StageName stage() {
        return StageName.CONTENT;
    }

    @Override
    public boolean interruptible() {
        return true;
    }

    @Override
    public StageOutput execute(WorkUnit unit, StageContext context) {
        List<String> refs = unit.targetRefs();
        var entries = new ArrayList<ContentEntry>();
        for (int i = 0; i < refs.size(); i++) {
            if (context.guard().shouldYield()) {
                log.warn("Time budget nearly exhausted after {} of {} lesson(s) in {}, yielding",
                        i, refs.size(), unit.unitId());
                return StageOutput.partial(StagePayload.ofEntries(entries), refs.subList(i, refs.size()));
            }
            entries.add(writeLesson(refs.get(i), context));
        }
        return StageOutput.complete(StagePayload.ofEntries(entries));
    }

    private ContentEntry writeLesson(String ref, StageContext context) {
        var outline = context.outline();
        OutlineLesson lesson = outline.findLesson(ref).orElseThrow(() ->
                new GenerationServiceException(ErrorClass.MALFORMED_INPUT, "Lesson " + ref + " is not in the outline"));
        OutlineModule module = outline.module(lesson.moduleNumber()).orElseThrow(() ->
                new GenerationServiceException(ErrorClass.MALFORMED_INPUT, "Module " + lesson.moduleNumber() + " is not in the outline"));

        var generation = context.generation();
        var response = generationService.generate(GenerationPrompt.text(
                PromptTemplates.LESSON_SYSTEM,
                PromptTemplates.lesson(outline, module, lesson, generation.overrides()),
                PromptTemplates.constraints(StageName.CONTENT, ref, generation)));
        String text = response.text().strip();
        if (text.isEmpty()) {
            throw new GenerationServiceException(ErrorClass.TRANSIENT_REJECTION, "Empty lesson content for " + ref);
        }

        String key = StorageKeys.lesson(generation.projectFolder(), context.revision(), lesson.moduleNumber(),
                lesson.lessonNumber(), lesson.title());
        artifactStore.putText(key, text);
        log.info("Lesson {} written to {} ({} words)", ref, key, text.split("\\s+").length);
        return new ContentEntry(ref, ContentKind.LESSON, lesson.title(), key, text, List.of());
    }
}
