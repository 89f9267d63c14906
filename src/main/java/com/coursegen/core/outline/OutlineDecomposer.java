package com.coursegen.core.outline;

import com.coursegen.core.config.CoursegenProperties;
import com.coursegen.core.model.ContentScope;
import com.coursegen.core.model.GenerationContext;
import com.coursegen.core.model.GenerationMode;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.model.WorkUnitKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Turns a course outline into the ordered list of work units for a run.
 * <p>
 * In {@code NEW} mode modules are walked in outline order; each module's lessons are
 * grouped into batches of at most {@code maxLessonsPerBatch} and its labs into batches of
 * at most {@code maxLabsPerBatch}. In {@code REGENERATE} mode a single unit covering
 * exactly the requested refs is produced. Either way every in-scope ref appears in
 * exactly one unit.
 */
@Service
public class OutlineDecomposer {

    private static final Logger log = LoggerFactory.getLogger(OutlineDecomposer.class);

    private final int maxLessonsPerBatch;
    private final int maxLabsPerBatch;

    @Autowired
    public OutlineDecomposer(CoursegenProperties properties) {
        this(properties.getOrchestrator().getMaxLessonsPerBatch(),
                properties.getOrchestrator().getMaxLabsPerBatch());
    }

    public OutlineDecomposer(int maxLessonsPerBatch, int maxLabsPerBatch) {
        if (maxLessonsPerBatch < 1 || maxLabsPerBatch < 1) {
            throw new IllegalArgumentException("Batch sizes must be at least 1");
        }
        this.maxLessonsPerBatch = maxLessonsPerBatch;
        this.maxLabsPerBatch = maxLabsPerBatch;
    }

    /**
     * @throws StructuralValidationException if the outline lacks the sections the request needs
     */
    public Decomposition decompose(CourseOutline outline, DecompositionRequest request) {
        if (outline == null || outline.modules().isEmpty()) {
            throw new StructuralValidationException("Outline has no modules");
        }
        var units = request.mode() == GenerationMode.REGENERATE
                ? List.of(regenerationUnit(outline, request))
                : batches(outline, request);
        log.info("Decomposed outline '{}' into {} work unit(s) [mode={}]",
                outline.title(), units.size(), request.mode());
        return new Decomposition(units, outline.warnings());
    }

    private List<WorkUnit> batches(CourseOutline outline, DecompositionRequest request) {
        var problems = new ArrayList<String>();
        var selected = new ArrayList<OutlineModule>();
        if (request.modules().isEmpty()) {
            selected.addAll(outline.modules());
        } else {
            for (int number : request.modules()) {
                outline.module(number).ifPresentOrElse(selected::add,
                        () -> problems.add("Module " + number + " is not in the outline"));
            }
        }

        boolean lessons = request.contentScope() != ContentScope.LABS;
        boolean labs = request.contentScope() != ContentScope.LESSONS;
        var context = request.context();
        var units = new ArrayList<WorkUnit>();
        for (var module : selected) {
            if (lessons && module.lessons().isEmpty() && (!labs || module.labs().isEmpty())) {
                problems.add("Module " + module.number() + " has no lessons");
            }
            if (lessons) {
                var refs = module.lessons().stream().map(OutlineLesson::ref).toList();
                addBatches(units, module.number(), "lessons", WorkUnitKind.LESSON_BATCH, refs,
                        maxLessonsPerBatch, context);
            }
            if (labs) {
                var refs = module.labs().stream().map(OutlineLab::labId).toList();
                addBatches(units, module.number(), "labs", WorkUnitKind.LAB_BATCH, refs,
                        maxLabsPerBatch, context);
            }
        }
        if (problems.isEmpty() && units.isEmpty()) {
            problems.add(request.contentScope() == ContentScope.LABS
                    ? "Outline declares no lab activities"
                    : "Outline declares no lessons");
        }
        if (!problems.isEmpty()) {
            throw new StructuralValidationException(problems);
        }
        return units;
    }

    private static void addBatches(List<WorkUnit> units, int module, String label, WorkUnitKind kind,
                                   List<String> refs, int batchSize, GenerationContext context) {
        int batch = 1;
        for (int start = 0; start < refs.size(); start += batchSize) {
            var slice = refs.subList(start, Math.min(start + batchSize, refs.size()));
            units.add(new WorkUnit(String.format("m%02d-%s-%d", module, label, batch++), kind, slice, context));
        }
    }

    private WorkUnit regenerationUnit(CourseOutline outline, DecompositionRequest request) {
        var targets = new ArrayList<>(new LinkedHashSet<>(request.targetRefs()));
        if (targets.isEmpty()) {
            throw new StructuralValidationException("Regeneration requires at least one target ref");
        }
        var problems = new ArrayList<String>();
        long lessonRefs = targets.stream().filter(OutlineRefs::isLessonRef).count();
        long labRefs = targets.stream().filter(OutlineRefs::isLabRef).count();
        if (lessonRefs + labRefs != targets.size()) {
            problems.add("Unrecognized target refs: " + targets.stream()
                    .filter(r -> !OutlineRefs.isLessonRef(r) && !OutlineRefs.isLabRef(r)).toList());
        } else if (lessonRefs > 0 && labRefs > 0) {
            problems.add("A regeneration targets either one lesson or a list of labs, not both");
        } else if (lessonRefs > 1) {
            problems.add("Lesson regeneration targets exactly one lesson, got " + targets);
        }
        for (String ref : targets) {
            boolean known = OutlineRefs.isLessonRef(ref)
                    ? outline.findLesson(ref).isPresent()
                    : outline.findLab(ref).isPresent();
            if (!known && (OutlineRefs.isLessonRef(ref) || OutlineRefs.isLabRef(ref))) {
                problems.add("Target " + ref + " is not in the outline");
            }
        }
        if (!problems.isEmpty()) {
            throw new StructuralValidationException(problems);
        }

        if (lessonRefs == 1) {
            return new WorkUnit("regen-" + targets.get(0), WorkUnitKind.LESSON_REGEN, targets, request.context());
        }
        return new WorkUnit("regen-labs-" + String.join("_", targets), WorkUnitKind.LAB_REGEN, targets,
                request.context());
    }
}
