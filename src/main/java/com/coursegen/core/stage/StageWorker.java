package com.coursegen.core.stage;

import com.coursegen.core.model.StageName;
import com.coursegen.core.model.WorkUnit;

/**
 * One pipeline stage. Workers are stateless Spring beans; everything they need
 * comes from the unit and the {@link StageContext}.
 */
public interface StageWorker {

    StageName stage();

    /**
     * Interruptible stages check the time budget between sub-steps and may return
     * {@link StageOutput#partial}. Other stages run to completion or fail.
     */
    default boolean interruptible() {
        return false;
    }

    /**
     * Runs the stage once. Throwing signals failure; the adapter classifies and retries.
     *
     * @param unit    the work unit, or {@code null} for run-level stages such as assembly
     * @param context run-scoped inputs and prior stage outputs
     */
    StageOutput execute(WorkUnit unit, StageContext context) throws Exception;
}
