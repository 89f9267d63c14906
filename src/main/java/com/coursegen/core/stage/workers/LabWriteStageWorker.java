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
import com.coursegen.core.outline.OutlineLab;
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
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes a lab guide from each lab plan. Interruptible between labs.
 */
@Component
public class LabWriteStageWorker implements StageWorker {

    private static final Logger log = LoggerFactory.getLogger(LabWriteStageWorker.class);

    private final GenerationService generationService;
    private final ArtifactStore artifactStore;

    public LabWriteStageWorker(GenerationService generationService, ArtifactStore artifactStore) {
        this.generationService = generationService;
        this.artifactStore = artifactStore;
    }

    @Override
    public StageName stage() {
        return StageName.LAB_WRITE;
    }

    @Override
    public boolean interruptible() {
        return true;
    }

    @Override
    public StageOutput execute(WorkUnit unit, StageContext context) {
        Map<String, ContentEntry> plans = context.previous(StageName.LAB_PLAN)
                .map(r -> r.payload().entries().stream()
                        .collect(Collectors.toMap(ContentEntry::targetRef, Function.identity())))
                .orElseThrow(() -> new IllegalStateException("Lab writing for " + unit.unitId() + " ran without plans"));

        List<String> refs = unit.targetRefs();
        var guides = new ArrayList<ContentEntry>();
        for (int i = 0; i < refs.size(); i++) {
            String labId = refs.get(i);
            if (context.guard().shouldYield()) {
                log.warn("Time budget nearly exhausted after {} of {} lab(s) in {}, yielding",
                        i, refs.size(), unit.unitId());
                return StageOutput.partial(StagePayload.ofEntries(guides), refs.subList(i, refs.size()));
            }
            OutlineLab lab = context.outline().findLab(labId).orElseThrow(() ->
                    new GenerationServiceException(ErrorClass.MALFORMED_INPUT, "Lab " + labId + " is not in the outline"));
            ContentEntry plan = plans.get(labId);
            if (plan == null) {
                throw new IllegalStateException("No plan produced for lab " + labId);
            }
            var response = generationService.generate(GenerationPrompt.text(
                    PromptTemplates.LAB_GUIDE_SYSTEM,
                    PromptTemplates.labGuide(lab, plan.text(), context.generation().overrides()),
                    PromptTemplates.constraints(StageName.LAB_WRITE, labId, context.generation())));
            String guide = response.text().strip();
            if (guide.isEmpty()) {
                throw new GenerationServiceException(ErrorClass.TRANSIENT_REJECTION, "Empty lab guide for " + labId);
            }
            String key = StorageKeys.labGuide(context.generation().projectFolder(), context.revision(), labId);
            artifactStore.putText(key, guide);
            guides.add(new ContentEntry(labId, ContentKind.LAB, lab.title(), key, guide, List.of()));
        }
        return StageOutput.complete(StagePayload.ofEntries(guides));
    }
}
