package com.coursegen.core.logging;

import org.slf4j.MDC;

/**
 * Coursegen MDC keys for structured logging: {@code runId}, {@code unitId}, {@code stage}.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String UNIT_ID = "unitId";
    public static final String STAGE = "stage";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setUnit(String runId, String unitId) {
        MDC.put(RUN_ID, runId);
        MDC.put(UNIT_ID, unitId);
    }

    public static void setStage(String stage) {
        MDC.put(STAGE, stage);
    }

    public static void clearStage() {
        MDC.remove(STAGE);
    }

    public static void clearUnit() {
        MDC.remove(UNIT_ID);
        MDC.remove(STAGE);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(UNIT_ID);
        MDC.remove(STAGE);
    }
}
