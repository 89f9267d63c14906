package com.coursegen.core.accumulator;

import com.coursegen.core.metrics.GenerationMetrics;
import com.coursegen.core.model.CompletionStatus;
import com.coursegen.core.model.ContentEntry;
import com.coursegen.core.model.ImageBinding;
import com.coursegen.core.model.RunState;
import com.coursegen.core.model.UnitResult;
import com.coursegen.core.persistence.RunStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Folds unit results into a {@link RunState}.
 * <p>
 * Merge rules:
 * <ul>
 *   <li>An entry for a ref that already exists is skipped, unless the ref is an open
 *       replacement target; a target is replaced once and then closed.</li>
 *   <li>Image bindings are merged only for accepted entries. Re-binding an id to the same
 *       value is a no-op; binding it to a different value is a {@link MergeConflictException}.</li>
 *   <li>Completed unit ids only grow, and the artifact becomes {@code COMPLETE} once every
 *       expected unit has reported. Only that transition is flagged ready for assembly.</li>
 * </ul>
 * Merging the same result twice leaves the state unchanged.
 */
@Component
public class ResultAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ResultAccumulator.class);

    private final RunStateStore store;
    private final GenerationMetrics metrics;

    @Autowired
    public ResultAccumulator(RunStateStore store, GenerationMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    /** Test constructor without metrics. */
    public ResultAccumulator(RunStateStore store) {
        this(store, null);
    }

    /**
     * Opens a ledger that serializes commits against {@code initial} and persists each one.
     */
    public RunLedger open(RunState initial) {
        store.save(initial);
        return new RunLedger(this, store, initial);
    }

    /**
     * Pure merge of {@code result} into {@code state}. Throws {@link MergeConflictException}
     * without producing a new state when an image binding conflicts.
     */
    public MergeOutcome merge(RunState state, UnitResult result) {
        var content = new LinkedHashMap<>(state.accumulatedContent());
        var images = new LinkedHashMap<>(state.imageBindings());
        var targets = new ArrayList<>(state.replacementTargets());
        var accepted = new ArrayList<ContentEntry>();
        var skipped = new ArrayList<String>();

        for (ContentEntry entry : result.entries()) {
            String ref = entry.targetRef();
            ContentEntry existing = content.get(ref);
            if (existing == null) {
                content.put(ref, entry);
                targets.remove(ref);
                accepted.add(entry);
            } else if (targets.remove(ref)) {
                existing.imageIds().forEach(images::remove);
                content.put(ref, entry);
                accepted.add(entry);
            } else {
                skipped.add(ref);
            }
        }

        for (ContentEntry entry : accepted) {
            for (Integer id : entry.imageIds()) {
                ImageBinding incoming = result.images().get(id);
                if (incoming == null) {
                    continue;
                }
                ImageBinding current = images.get(id);
                if (current == null) {
                    images.put(id, incoming);
                } else if (!current.equals(incoming)) {
                    throw new MergeConflictException(id, current, incoming);
                }
            }
        }

        var completed = new ArrayList<>(state.completedUnitIds());
        String completionId = state.completionId(result.originUnitId());
        if (result.unitFinished() && !completed.contains(completionId)) {
            completed.add(completionId);
        }
        CompletionStatus status = state.isComplete() || completed.size() >= state.unitsTotal()
                ? CompletionStatus.COMPLETE : CompletionStatus.PARTIAL;
        boolean ready = !state.isComplete() && status == CompletionStatus.COMPLETE;

        if (!skipped.isEmpty()) {
            log.info("Unit {} re-delivered {} existing ref(s), skipped: {}", result.unitId(), skipped.size(), skipped);
            if (metrics != null) {
                metrics.recordMergeSkipped(skipped.size());
            }
        }

        var next = new RunState(state.runId(), state.scope(), state.revision(), state.unitsTotal(),
                completed, content, images, status, targets, state.pendingUnits(), state.context());
        List<String> acceptedRefs = accepted.stream().map(ContentEntry::targetRef).toList();
        return new MergeOutcome(next, acceptedRefs, skipped, ready);
    }
}
