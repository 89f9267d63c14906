package com.coursegen.core.stage.workers;

import com.coursegen.core.generation.GenerationPrompt;
import com.coursegen.core.generation.GenerationService;
import com.coursegen.core.generation.GenerationServiceException;
import com.coursegen.core.model.ErrorClass;
import com.coursegen.core.model.ImageBinding;
import com.coursegen.core.model.StageName;
import com.coursegen.core.model.StagePayload;
import com.coursegen.core.model.VisualPrompt;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.stage.StageContext;
import com.coursegen.core.stage.StageOutput;
import com.coursegen.core.stage.StageWorker;
import com.coursegen.core.storage.ArtifactStore;
import com.coursegen.core.storage.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Renders planned visuals and stores them as PNGs.
 * <p>
 * Not interruptible. Images already present under the current revision's key are
 * reused, so a retry only renders what the failed attempt did not finish.
 */
@Component
public class ImageRenderStageWorker implements StageWorker {

    private static final Logger log = LoggerFactory.getLogger(ImageRenderStageWorker.class);

    private final GenerationService generationService;
    private final ArtifactStore artifactStore;

    public ImageRenderStageWorker(GenerationService generationService, ArtifactStore artifactStore) {
        this.generationService = generationService;
        this.artifactStore = artifactStore;
    }

    @Override
    public StageName stage() {
        return StageName.IMAGE_RENDER;
    }

    @Override
    public StageOutput execute(WorkUnit unit, StageContext context) throws InterruptedException {
        List<VisualPrompt> prompts = context.previous(StageName.VISUAL_PLAN)
                .map(r -> r.payload().visualPrompts())
                .orElseThrow(() -> new IllegalStateException(
                        "Image rendering for " + unit.unitId() + " ran without a visual plan"));

        var images = new LinkedHashMap<Integer, ImageBinding>();
        for (VisualPrompt prompt : prompts) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Image rendering for " + unit.unitId() + " was cancelled after "
                        + images.size() + " of " + prompts.size() + " image(s)");
            }
            String key = StorageKeys.image(context.generation().projectFolder(), context.revision(), prompt.imageId());
            if (artifactStore.exists(key)) {
                log.debug("Image {} already rendered at {}", prompt.imageId(), key);
            } else {
                var response = generationService.generate(GenerationPrompt.image(prompt.prompt(),
                        PromptTemplates.constraints(StageName.IMAGE_RENDER, prompt.targetRef(), context.generation())));
                if (response.binary().length == 0) {
                    throw new GenerationServiceException(ErrorClass.TRANSIENT_REJECTION,
                            "No image data returned for image " + prompt.imageId());
                }
                artifactStore.put(key, response.binary());
            }
            images.put(prompt.imageId(), new ImageBinding(key, prompt.description()));
        }
        log.info("Rendered {} image(s) for {}", images.size(), unit.unitId());
        return StageOutput.complete(StagePayload.ofImages(images));
    }
}
