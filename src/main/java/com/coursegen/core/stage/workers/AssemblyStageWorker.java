package com.coursegen.core.stage.workers;

import com.coursegen.core.assembly.DocumentAssembler;
import com.coursegen.core.model.ContentEntry;
import com.coursegen.core.model.StageName;
import com.coursegen.core.model.StagePayload;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.stage.StageContext;
import com.coursegen.core.stage.StageOutput;
import com.coursegen.core.stage.StageWorker;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Run-level stage that assembles the course document once the artifact is complete.
 * Interruptible between sections; a partial result writes nothing.
 */
@Component
public class AssemblyStageWorker implements StageWorker {

    private final DocumentAssembler assembler;

    public AssemblyStageWorker(DocumentAssembler assembler) {
        this.assembler = assembler;
    }

    @Override
    public StageName stage() {
        return StageName.ASSEMBLY;
    }

    @Override
    public boolean interruptible() {
        return true;
    }

    @Override
    public StageOutput execute(WorkUnit unit, StageContext context) {
        var state = context.runState();
        List<String> refs = context.outline().orderedRefs().stream()
                .filter(state.accumulatedContent()::containsKey)
                .toList();

        var sections = new ArrayList<String>();
        for (int i = 0; i < refs.size(); i++) {
            if (context.guard().shouldYield()) {
                return StageOutput.partial(StagePayload.empty(), refs.subList(i, refs.size()));
            }
            ContentEntry entry = state.accumulatedContent().get(refs.get(i));
            sections.add(assembler.renderSection(entry, state.imageBindings()));
        }
        String key = assembler.assemble(context.outline(), sections, context.generation().projectFolder());
        return StageOutput.complete(StagePayload.ofDocument(key));
    }
}
