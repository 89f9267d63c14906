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
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Plans each lab of a unit before its guide is written.
 */
@Component
public class LabPlanStageWorker implements StageWorker {

    private final GenerationService generationService;
    private final ArtifactStore artifactStore;

    public LabPlanStageWorker(GenerationService generationService, ArtifactStore artifactStore) {
        this.generationService = generationService;
        this.artifactStore = artifactStore;
    }

    @Override
    public StageName stage() {
        return StageName.LAB_PLAN;
    }

    @Override
    public StageOutput execute(WorkUnit unit, StageContext context) {
        var plans = new ArrayList<ContentEntry>();
        for (String labId : unit.targetRefs()) {
            OutlineLab lab = context.outline().findLab(labId).orElseThrow(() ->
                    new GenerationServiceException(ErrorClass.MALFORMED_INPUT, "Lab " + labId + " is not in the outline"));
            var response = generationService.generate(GenerationPrompt.text(
                    PromptTemplates.LAB_PLAN_SYSTEM,
                    PromptTemplates.labPlan(context.outline(), lab, context.generation().overrides()),
                    PromptTemplates.constraints(StageName.LAB_PLAN, labId, context.generation())));
            String plan = response.text().strip();
            if (plan.isEmpty()) {
                throw new GenerationServiceException(ErrorClass.TRANSIENT_REJECTION, "Empty lab plan for " + labId);
            }
            String key = StorageKeys.labPlan(context.generation().projectFolder(), context.revision(), labId);
            artifactStore.putText(key, plan);
            plans.add(new ContentEntry(labId, ContentKind.LAB_PLAN, lab.title(), key, plan, List.of()));
        }
        return StageOutput.complete(StagePayload.ofEntries(plans));
    }
}
